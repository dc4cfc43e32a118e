package org.example.assignment.service.remote;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Table-oriented backend the gate and the session pipeline talk to.
 * Rows are plain column maps; every call completes asynchronously.
 */
public interface RemoteDataSource {

    /**
     * Read rows whose columns equal every entry of {@code filter}.
     *
     * @param limit maximum rows to return, or zero for no limit
     */
    CompletableFuture<List<Map<String, Object>>> read(String resource, Map<String, Object> filter, int limit);

    /**
     * Insert rows and return them as stored, including backend-assigned ids.
     */
    CompletableFuture<List<Map<String, Object>>> insert(String table, List<Map<String, Object>> rows);

    /**
     * Insert rows, replacing any existing row that matches on {@code conflictColumns}.
     */
    CompletableFuture<List<Map<String, Object>>> upsert(
            String table,
            List<Map<String, Object>> rows,
            List<String> conflictColumns);

    /**
     * Patch the row with the given id and return it as stored.
     */
    CompletableFuture<Map<String, Object>> update(String table, String id, Map<String, Object> patch);

    String getSourceName();
}
