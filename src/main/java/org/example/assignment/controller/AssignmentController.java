package org.example.assignment.controller;

import org.example.assignment.model.FetchState;
import org.example.assignment.service.AssignmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api")
public class AssignmentController {

    private final AssignmentService assignmentService;

    public AssignmentController(AssignmentService assignmentService) {
        this.assignmentService = assignmentService;
    }

    @GetMapping("/assignments/{assignmentId}")
    public CompletableFuture<ResponseEntity<Object>> getAssignment(@PathVariable String assignmentId) {
        return assignmentService.fetchAssignment(assignmentId)
                .handle((assignment, error) -> error == null
                        ? ResponseEntity.ok(assignment)
                        : ApiErrors.toResponse(error));
    }

    @GetMapping("/assignments/{assignmentId}/fetch-state")
    public FetchStateResponse getFetchState(@PathVariable String assignmentId) {
        return new FetchStateResponse(assignmentId, assignmentService.getFetchState(assignmentId));
    }

    @DeleteMapping("/assignments/{assignmentId}/cache")
    public ResponseEntity<Void> invalidate(@PathVariable String assignmentId) {
        assignmentService.invalidate(assignmentId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Drops every cached assignment and listing, e.g. when the user logs out.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<Void> clearCache() {
        assignmentService.clearCache();
        return ResponseEntity.noContent().build();
    }

    public record FetchStateResponse(String assignmentId, FetchState state) {
    }
}
