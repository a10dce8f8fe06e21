package io.crewmesh.reputation;

import java.util.List;

/**
 * Length and structure based quality estimate for a task result, used when no reviewer has
 * scored it yet.
 */
public final class OutputQualityHeuristic {
    static final double TRIVIAL_SCORE = 20.0;
    static final double BASELINE = 60.0;
    static final double CAP = 95.0;
    private static final List<String> STRUCTURE_MARKERS = List.of("#", "- ", "```", "1.");

    private OutputQualityHeuristic() {
    }

    public static double score(String output) {
        String text = output == null ? "" : output.strip();
        if (text.length() < 10) {
            return TRIVIAL_SCORE;
        }
        double score = BASELINE;
        if (text.length() > 200) {
            score += 10.0;
        }
        if (text.length() > 500) {
            score += 5.0;
        }
        if (STRUCTURE_MARKERS.stream().anyMatch(text::contains)) {
            score += 10.0;
        }
        return Math.min(CAP, score);
    }
}
