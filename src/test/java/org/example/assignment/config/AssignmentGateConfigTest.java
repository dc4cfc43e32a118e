package org.example.assignment.config;

import org.example.assignment.service.gate.FailurePolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AssignmentGateConfigTest {

    @Test
    void parseFailurePolicy_acceptsBothSpellings() {
        assertEquals(FailurePolicy.STRICT, AssignmentGateConfig.parseFailurePolicy("strict"));
        assertEquals(FailurePolicy.FAIL_OPEN, AssignmentGateConfig.parseFailurePolicy("fail-open"));
        assertEquals(FailurePolicy.FAIL_OPEN, AssignmentGateConfig.parseFailurePolicy("FAIL_OPEN"));
    }

    @Test
    void parseFailurePolicy_unknownOrBlank_fallsBackToFailOpen() {
        assertEquals(FailurePolicy.FAIL_OPEN, AssignmentGateConfig.parseFailurePolicy("sometimes"));
        assertEquals(FailurePolicy.FAIL_OPEN, AssignmentGateConfig.parseFailurePolicy(" "));
        assertEquals(FailurePolicy.FAIL_OPEN, AssignmentGateConfig.parseFailurePolicy(null));
    }
}
