package org.example.assignment.model;

import java.util.List;

public record Assignment(
        String id,
        String title,
        String description,
        String organizationId,
        List<Question> questions
) {

    public Assignment {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public List<String> questionIds() {
        return questions.stream()
                .map(Question::id)
                .toList();
    }
}
