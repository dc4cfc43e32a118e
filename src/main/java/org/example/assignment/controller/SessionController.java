package org.example.assignment.controller;

import org.example.assignment.model.SessionSnapshot;
import org.example.assignment.service.SubmissionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api")
public class SessionController {

    private final SubmissionService submissionService;

    public SessionController(SubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @PostMapping("/sessions")
    public CompletableFuture<ResponseEntity<Object>> startSession(@RequestBody StartSessionRequest request) {
        if (request == null || request.assignmentId() == null || request.assignmentId().isBlank()) {
            return CompletableFuture.completedFuture(
                    ResponseEntity.badRequest().body(ApiError.of("bad_request", "assignmentId is required")));
        }
        return submissionService.startSession(request.assignmentId(), request.userId())
                .handle((session, error) -> error == null
                        ? ResponseEntity.status(HttpStatus.CREATED).body(session)
                        : ApiErrors.toResponse(error));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionSnapshot> getSession(@PathVariable String sessionId) {
        return submissionService.getSession(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/sessions/{sessionId}/responses/{questionId}")
    public ResponseEntity<Object> recordResponse(
            @PathVariable String sessionId,
            @PathVariable String questionId,
            @RequestBody ResponseRequest request) {
        return respond(() -> submissionService.recordResponse(
                sessionId,
                questionId,
                request.payload(),
                request.correct()));
    }

    @PostMapping("/sessions/{sessionId}/visits/{questionId}")
    public ResponseEntity<Object> markVisited(@PathVariable String sessionId, @PathVariable String questionId) {
        return respond(() -> submissionService.markVisited(sessionId, questionId));
    }

    @PostMapping("/sessions/{sessionId}/submit")
    public CompletableFuture<ResponseEntity<Object>> submit(@PathVariable String sessionId) {
        return submissionService.submit(sessionId)
                .handle((result, error) -> error == null
                        ? ResponseEntity.ok(result)
                        : ApiErrors.toResponse(error));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        return submissionService.endSession(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/users/{userId}/submissions")
    public CompletableFuture<ResponseEntity<Object>> listSubmissions(
            @PathVariable String userId,
            @RequestParam(defaultValue = "false") boolean refresh) {
        return submissionService.listUserSubmissions(userId, refresh)
                .handle((summaries, error) -> error == null
                        ? ResponseEntity.ok(summaries)
                        : ApiErrors.toResponse(error));
    }

    private ResponseEntity<Object> respond(Supplier<SessionSnapshot> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    public record StartSessionRequest(String assignmentId, String userId) {
    }

    public record ResponseRequest(Map<String, Object> payload, boolean correct) {
    }
}
