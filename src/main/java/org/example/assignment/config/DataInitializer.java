package org.example.assignment.config;

import org.example.assignment.service.remote.BackendTables;
import org.example.assignment.service.remote.InMemoryRemoteDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds the in-memory backend with a sample assignment for local development.
 */
@Component
@Profile({"dev", "test"})
@ConditionalOnProperty(name = "remote.mode", havingValue = "in-memory", matchIfMissing = true)
public class DataInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    static final String SAMPLE_ASSIGNMENT_ID = "sample-first-steps";

    private final InMemoryRemoteDataSource remoteDataSource;

    public DataInitializer(InMemoryRemoteDataSource remoteDataSource) {
        this.remoteDataSource = remoteDataSource;
    }

    @Override
    public void run(String... args) {
        if (remoteDataSource.count(BackendTables.ASSIGNMENT) > 0) {
            log.info("Backend already contains assignments, skipping initialization");
            return;
        }

        Map<String, Object> assignment = new LinkedHashMap<>();
        assignment.put(BackendTables.ID, SAMPLE_ASSIGNMENT_ID);
        assignment.put("title", "First Steps");
        assignment.put("description", "A short warm-up quiz.");
        assignment.put("organization_id", "sample-school");
        remoteDataSource.insert(BackendTables.ASSIGNMENT, List.of(assignment)).join();

        List<Map<String, Object>> questions = new ArrayList<>();
        questions.add(question("q1", "multiple-choice", "Which of these is a primary colour?", 1));
        questions.add(question("q2", "true-false", "The sun rises in the east.", 2));
        questions.add(question("q3", "matching", "Match each animal to its home.", 3));
        questions.add(question("q4", "ordering", "Put the numbers in order from smallest to largest.", 4));
        questions.add(question("q5", "multiple-choice", "How many legs does a spider have?", 5));
        remoteDataSource.insert(BackendTables.QUESTION, questions).join();

        log.info("Seeded sample assignment '{}' with {} questions", SAMPLE_ASSIGNMENT_ID, questions.size());
    }

    private Map<String, Object> question(String id, String type, String text, int order) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(BackendTables.ID, id);
        row.put(BackendTables.ASSIGNMENT_ID, SAMPLE_ASSIGNMENT_ID);
        row.put("question_type", type);
        row.put("question_text", text);
        row.put("order", order);
        return row;
    }
}
