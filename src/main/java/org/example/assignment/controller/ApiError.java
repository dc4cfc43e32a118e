package org.example.assignment.controller;

public record ApiError(
        String error,
        String message,
        String submissionId
) {

    public static ApiError of(String error, String message) {
        return new ApiError(error, message, null);
    }
}
