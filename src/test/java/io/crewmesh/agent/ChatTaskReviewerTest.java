package io.crewmesh.agent;

import io.crewmesh.llm.ChatException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ChatTaskReviewerTest {
    private static final ReviewRequest REQUEST =
            new ReviewRequest("tsk_1", "author", "Summarize the report", "A short but complete summary.");

    @Test
    void parsesJsonEmbeddedInProse() throws Exception {
        ChatTaskReviewer reviewer = new ChatTaskReviewer(
                (messages, model) -> "Sure.\n{\"score\": 82, \"comment\": \"solid\"}\nThanks",
                "reviewer-model",
                new HeuristicTaskReviewer());

        ReviewVerdict verdict = reviewer.review(REQUEST);
        Assertions.assertEquals(82.0, verdict.score());
        Assertions.assertEquals("solid", verdict.comment());
    }

    @Test
    void clampsOutOfRangeScores() throws Exception {
        Assertions.assertEquals(100.0, ChatTaskReviewer.parse("{\"score\": 250}").score());
        Assertions.assertEquals(0.0, ChatTaskReviewer.parse("{\"score\": -3, \"comment\": null}").score());
    }

    @Test
    void fallsBackWhenReplyIsUnusable() throws Exception {
        ChatTaskReviewer noScore = new ChatTaskReviewer(
                (messages, model) -> "{\"comment\": \"forgot the score\"}",
                "reviewer-model",
                request -> new ReviewVerdict(42.0, "fallback"));
        Assertions.assertEquals(42.0, noScore.review(REQUEST).score());

        ChatTaskReviewer prose = new ChatTaskReviewer(
                (messages, model) -> "looks fine to me",
                "reviewer-model",
                request -> new ReviewVerdict(43.0, "fallback"));
        Assertions.assertEquals(43.0, prose.review(REQUEST).score());
    }

    @Test
    void fallsBackWhenChatFails() throws Exception {
        ChatTaskReviewer reviewer = new ChatTaskReviewer(
                (messages, model) -> {
                    throw new ChatException("rate limited");
                },
                "reviewer-model",
                new HeuristicTaskReviewer());

        ReviewVerdict verdict = reviewer.review(REQUEST);
        Assertions.assertEquals(60.0, verdict.score());
        Assertions.assertEquals("heuristic review", verdict.comment());
    }
}
