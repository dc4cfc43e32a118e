package org.example.assignment.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The answer recorded for one question of a session. Later answers to the same question replace earlier ones.
 */
public record QuestionResponse(
        String questionId,
        Map<String, Object> payload,
        boolean correct
) {

    public QuestionResponse {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Stand-in for a question the user reached but never answered.
     */
    public static QuestionResponse unanswered(String questionId) {
        return new QuestionResponse(questionId, Map.of(), false);
    }
}
