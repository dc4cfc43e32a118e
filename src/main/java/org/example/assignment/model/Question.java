package org.example.assignment.model;

public record Question(
        String id,
        String questionType,
        String questionText,
        int order
) {
}
