package org.example.assignment.service;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for failures that arrive wrapped by {@link java.util.concurrent.CompletableFuture}.
 */
public final class Futures {

    private Futures() {
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }
}
