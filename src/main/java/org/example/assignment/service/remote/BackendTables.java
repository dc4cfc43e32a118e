package org.example.assignment.service.remote;

/**
 * Table and column names shared by the fetch and submission paths.
 */
public final class BackendTables {

    public static final String ASSIGNMENT = "interactive_assignment";
    public static final String QUESTION = "interactive_question";
    public static final String SUBMISSION = "interactive_submission";
    public static final String RESPONSE = "interactive_response";

    public static final String ID = "id";
    public static final String ASSIGNMENT_ID = "assignment_id";
    public static final String SUBMISSION_ID = "submission_id";
    public static final String QUESTION_ID = "question_id";
    public static final String USER_ID = "user_id";

    private BackendTables() {
    }
}
