package org.example.assignment.model;

public enum FetchState {
    NOT_REQUESTED,
    FETCHING,
    LOADED,
    FAILED
}
