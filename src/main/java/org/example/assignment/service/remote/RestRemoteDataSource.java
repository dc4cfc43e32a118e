package org.example.assignment.service.remote;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * PostgREST-style backend (the REST dialect hosted Postgres services expose).
 *
 * <p>Filters become {@code column=eq.value} query parameters, upserts use
 * {@code on_conflict} with {@code Prefer: resolution=merge-duplicates}. Blocking HTTP calls
 * run on a dedicated executor so every method returns immediately; connect and read timeouts
 * bound each call.</p>
 */
@Component
@ConditionalOnProperty(name = "remote.mode", havingValue = "rest")
public class RestRemoteDataSource implements RemoteDataSource {

    private static final Logger log = LoggerFactory.getLogger(RestRemoteDataSource.class);

    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
            new ParameterizedTypeReference<>() {
            };
    private static final String PREFER = "Prefer";
    private static final String RETURN_REPRESENTATION = "return=representation";

    private final RestClient restClient;
    private final Executor executor;

    @Autowired
    public RestRemoteDataSource(
            RestClient.Builder restClientBuilder,
            @Value("${remote.rest.base-url}") String baseUrl,
            @Value("${remote.rest.api-key:}") String apiKey,
            @Value("${remote.rest.io-threads:4}") int ioThreads,
            @Value("${remote.rest.connect-timeout-ms:3000}") long connectTimeoutMs,
            @Value("${remote.rest.read-timeout-ms:10000}") long readTimeoutMs) {
        this(restClientBuilder.requestFactory(requestFactory(
                        Duration.ofMillis(Math.max(1, connectTimeoutMs)), Duration.ofMillis(Math.max(1, readTimeoutMs)))),
                baseUrl, apiKey,
                Executors.newFixedThreadPool(Math.max(1, ioThreads), new RemoteIoThreadFactory()));
    }

    RestRemoteDataSource(RestClient.Builder restClientBuilder, String baseUrl, String apiKey, Executor executor) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("remote.rest.base-url is required in rest mode");
        }
        RestClient.Builder builder = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);
        if (apiKey != null && !apiKey.isBlank()) {
            builder = builder
                    .defaultHeader("apikey", apiKey)
                    .defaultHeader("Authorization", "Bearer " + apiKey);
        }
        this.restClient = builder.build();
        this.executor = executor;
        log.info("REST backend configured at {}", baseUrl);
    }

    static JdkClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(readTimeout);
        return factory;
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> read(String resource, Map<String, Object> filter, int limit) {
        return async("read " + resource, () -> {
            List<Map<String, Object>> rows = restClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("/{resource}").queryParam("select", "*");
                        if (filter != null) {
                            filter.forEach((column, value) -> uriBuilder.queryParam(column, "eq." + value));
                        }
                        if (limit > 0) {
                            uriBuilder.queryParam("limit", limit);
                        }
                        return uriBuilder.build(resource);
                    })
                    .retrieve()
                    .body(ROWS);
            return rows == null ? List.of() : rows;
        });
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> insert(String table, List<Map<String, Object>> rows) {
        return async("insert into " + table, () -> {
            List<Map<String, Object>> stored = restClient.post()
                    .uri("/{table}", table)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(PREFER, RETURN_REPRESENTATION)
                    .body(rows)
                    .retrieve()
                    .body(ROWS);
            return stored == null ? List.of() : stored;
        });
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> upsert(
            String table,
            List<Map<String, Object>> rows,
            List<String> conflictColumns) {
        String onConflict = String.join(",", conflictColumns);
        return async("upsert into " + table, () -> {
            List<Map<String, Object>> stored = restClient.post()
                    .uri(uriBuilder -> uriBuilder.path("/{table}")
                            .queryParam("on_conflict", onConflict)
                            .build(table))
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(PREFER, "resolution=merge-duplicates," + RETURN_REPRESENTATION)
                    .body(rows)
                    .retrieve()
                    .body(ROWS);
            return stored == null ? List.of() : stored;
        });
    }

    @Override
    public CompletableFuture<Map<String, Object>> update(String table, String id, Map<String, Object> patch) {
        return async("update " + table + "/" + id, () -> {
            List<Map<String, Object>> stored = restClient.patch()
                    .uri(uriBuilder -> uriBuilder.path("/{table}")
                            .queryParam(BackendTables.ID, "eq." + id)
                            .build(table))
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(PREFER, RETURN_REPRESENTATION)
                    .body(patch)
                    .retrieve()
                    .body(ROWS);
            if (stored == null || stored.isEmpty()) {
                throw new RemoteDataSourceException("No row " + id + " in " + table);
            }
            return stored.get(0);
        });
    }

    @Override
    public String getSourceName() {
        return "rest";
    }

    @PreDestroy
    public void shutdown() {
        if (executor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
    }

    private <T> CompletableFuture<T> async(String description, Supplier<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.get();
            } catch (RestClientException e) {
                log.debug("Backend request failed: {}", description, e);
                throw new RemoteDataSourceException("Backend request failed: " + description, e);
            }
        }, executor);
    }

    private static final class RemoteIoThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "remote-io-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
