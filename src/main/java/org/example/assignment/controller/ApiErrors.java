package org.example.assignment.controller;

import org.example.assignment.service.AssignmentFetchException;
import org.example.assignment.service.AssignmentNotFoundException;
import org.example.assignment.service.Futures;
import org.example.assignment.service.SessionNotFoundException;
import org.example.assignment.service.SubmissionConflictException;
import org.example.assignment.service.SubmissionFailedException;
import org.example.assignment.service.gate.ConnectionException;
import org.example.assignment.service.gate.OperationTimeoutException;
import org.example.assignment.service.remote.RemoteDataSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps service failures to HTTP responses.
 */
final class ApiErrors {

    private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

    private ApiErrors() {
    }

    static ResponseEntity<Object> toResponse(Throwable error) {
        Throwable cause = Futures.unwrap(error);
        String message = Futures.describe(cause);

        if (cause instanceof AssignmentNotFoundException || cause instanceof SessionNotFoundException) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("not_found", message));
        }
        if (cause instanceof SubmissionConflictException) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiError.of("submission_in_progress", message));
        }
        if (cause instanceof SubmissionFailedException failed) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ApiError("submission_failed", message, failed.getSubmissionId()));
        }
        if (cause instanceof ConnectionException
                || cause instanceof OperationTimeoutException
                || cause instanceof AssignmentFetchException
                || cause instanceof RemoteDataSourceException) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiError.of("backend_unavailable", message));
        }
        if (cause instanceof IllegalArgumentException) {
            return ResponseEntity.badRequest().body(ApiError.of("bad_request", message));
        }
        if (cause instanceof IllegalStateException) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiError.of("invalid_state", message));
        }

        log.error("Unhandled request failure", cause);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.of("internal_error", message));
    }
}
