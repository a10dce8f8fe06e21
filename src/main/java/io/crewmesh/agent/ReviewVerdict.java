package io.crewmesh.agent;

public record ReviewVerdict(double score, String comment) {
    public ReviewVerdict {
        score = Math.max(0.0, Math.min(100.0, score));
        comment = comment == null ? "" : comment;
    }
}
