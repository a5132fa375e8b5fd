package com.mathquest.learning.api;

import com.mathquest.learning.assessment.AssessmentModels.DiagnosticResult;
import com.mathquest.learning.service.LearnerSessionService;
import com.mathquest.learning.service.SessionModels.AssessmentStep;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/assessment")
public class AssessmentController {
    private final LearnerSessionService sessionService;

    public AssessmentController(LearnerSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping("/start")
    public ResponseEntity<AssessmentStep> start(@RequestBody StartRequest request) {
        return ResponseEntity.ok(sessionService.startAssessment(request.learnerId()));
    }

    @PostMapping("/{sessionId}/answer")
    public ResponseEntity<AssessmentStep> answer(@PathVariable String sessionId, @RequestBody AnswerRequest request) {
        return ResponseEntity.ok(sessionService.answerAssessment(sessionId, request.answerIndex(), request.responseTimeMs()));
    }

    @GetMapping("/{learnerId}/result")
    public ResponseEntity<DiagnosticResult> result(@PathVariable String learnerId) {
        return ResponseEntity.ok(sessionService.assessmentResult(learnerId));
    }

    public record StartRequest(String learnerId) {}

    public record AnswerRequest(int answerIndex, long responseTimeMs) {}
}
