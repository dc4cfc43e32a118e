package org.example.assignment.service;

public class AssignmentNotFoundException extends RuntimeException {

    private final String assignmentId;

    public AssignmentNotFoundException(String assignmentId) {
        super("Assignment not found: " + assignmentId);
        this.assignmentId = assignmentId;
    }

    public String getAssignmentId() {
        return assignmentId;
    }
}
