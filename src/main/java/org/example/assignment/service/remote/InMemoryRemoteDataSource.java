package org.example.assignment.service.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local backend keyed by table, used when no remote database is configured.
 * Rows without an {@code id} get a random UUID on insert.
 */
@Component
@ConditionalOnProperty(name = "remote.mode", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryRemoteDataSource implements RemoteDataSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRemoteDataSource.class);

    private final ConcurrentHashMap<String, Map<String, Map<String, Object>>> tables = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<List<Map<String, Object>>> read(String resource, Map<String, Object> filter, int limit) {
        Map<String, Map<String, Object>> table = table(resource);
        List<Map<String, Object>> matches = new ArrayList<>();
        synchronized (table) {
            for (Map<String, Object> row : table.values()) {
                if (limit > 0 && matches.size() >= limit) {
                    break;
                }
                if (matchesAll(row, filter)) {
                    matches.add(new LinkedHashMap<>(row));
                }
            }
        }
        return CompletableFuture.completedFuture(matches);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> insert(String table, List<Map<String, Object>> rows) {
        Map<String, Map<String, Object>> target = table(table);
        List<Map<String, Object>> stored = new ArrayList<>();
        synchronized (target) {
            for (Map<String, Object> row : rows) {
                Map<String, Object> copy = withId(row);
                String id = String.valueOf(copy.get(BackendTables.ID));
                if (target.containsKey(id)) {
                    return CompletableFuture.failedFuture(
                            new RemoteDataSourceException("Duplicate id " + id + " in " + table));
                }
                target.put(id, copy);
                stored.add(new LinkedHashMap<>(copy));
            }
        }
        log.debug("Inserted {} rows into {}", stored.size(), table);
        return CompletableFuture.completedFuture(stored);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> upsert(
            String table,
            List<Map<String, Object>> rows,
            List<String> conflictColumns) {
        Map<String, Map<String, Object>> target = table(table);
        List<Map<String, Object>> stored = new ArrayList<>();
        synchronized (target) {
            for (Map<String, Object> row : rows) {
                Map<String, Object> existing = findConflict(target, row, conflictColumns);
                if (existing != null) {
                    Object id = existing.get(BackendTables.ID);
                    existing.putAll(row);
                    existing.put(BackendTables.ID, id);
                    stored.add(new LinkedHashMap<>(existing));
                } else {
                    Map<String, Object> copy = withId(row);
                    target.put(String.valueOf(copy.get(BackendTables.ID)), copy);
                    stored.add(new LinkedHashMap<>(copy));
                }
            }
        }
        log.debug("Upserted {} rows into {} on {}", stored.size(), table, conflictColumns);
        return CompletableFuture.completedFuture(stored);
    }

    @Override
    public CompletableFuture<Map<String, Object>> update(String table, String id, Map<String, Object> patch) {
        Map<String, Map<String, Object>> target = table(table);
        synchronized (target) {
            Map<String, Object> existing = target.get(id);
            if (existing == null) {
                return CompletableFuture.failedFuture(
                        new RemoteDataSourceException("No row " + id + " in " + table));
            }
            existing.putAll(patch);
            existing.put(BackendTables.ID, id);
            return CompletableFuture.completedFuture(new LinkedHashMap<>(existing));
        }
    }

    @Override
    public String getSourceName() {
        return "in-memory";
    }

    public int count(String table) {
        Map<String, Map<String, Object>> target = table(table);
        synchronized (target) {
            return target.size();
        }
    }

    private Map<String, Map<String, Object>> table(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name must not be blank");
        }
        return tables.computeIfAbsent(name, ignored -> new LinkedHashMap<>());
    }

    private Map<String, Object> withId(Map<String, Object> row) {
        Map<String, Object> copy = new LinkedHashMap<>(row);
        Object id = copy.get(BackendTables.ID);
        if (id == null || String.valueOf(id).isBlank()) {
            copy.put(BackendTables.ID, UUID.randomUUID().toString());
        }
        return copy;
    }

    private Map<String, Object> findConflict(
            Map<String, Map<String, Object>> target,
            Map<String, Object> row,
            List<String> conflictColumns) {
        if (conflictColumns == null || conflictColumns.isEmpty()) {
            Object id = row.get(BackendTables.ID);
            return id == null ? null : target.get(String.valueOf(id));
        }
        for (Map<String, Object> candidate : target.values()) {
            boolean same = true;
            for (String column : conflictColumns) {
                if (!Objects.equals(asText(candidate.get(column)), asText(row.get(column)))) {
                    same = false;
                    break;
                }
            }
            if (same) {
                return candidate;
            }
        }
        return null;
    }

    private boolean matchesAll(Map<String, Object> row, Map<String, Object> filter) {
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, Object> condition : filter.entrySet()) {
            if (!Objects.equals(asText(row.get(condition.getKey())), asText(condition.getValue()))) {
                return false;
            }
        }
        return true;
    }

    private String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
