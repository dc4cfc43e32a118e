package org.example.assignment.config;

import org.example.assignment.service.remote.BackendTables;
import org.example.assignment.service.remote.InMemoryRemoteDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DataInitializerTest {

    @Test
    void run_seedsSampleAssignmentOnce() {
        InMemoryRemoteDataSource dataSource = new InMemoryRemoteDataSource();
        DataInitializer initializer = new DataInitializer(dataSource);

        initializer.run();
        initializer.run();

        assertEquals(1, dataSource.count(BackendTables.ASSIGNMENT));
        List<Map<String, Object>> questions = dataSource.read(BackendTables.QUESTION,
                Map.of(BackendTables.ASSIGNMENT_ID, DataInitializer.SAMPLE_ASSIGNMENT_ID), 0).join();
        assertEquals(5, questions.size());
    }
}
