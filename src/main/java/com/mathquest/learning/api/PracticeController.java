package com.mathquest.learning.api;

import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.AdaptiveLearningState;
import com.mathquest.learning.service.LearnerSessionService;
import com.mathquest.learning.service.SessionModels.PracticeAnswerResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/practice/{learnerId}")
public class PracticeController {
    private final LearnerSessionService sessionService;

    public PracticeController(LearnerSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping("/next")
    public ResponseEntity<Question> next(@PathVariable String learnerId,
                                         @RequestParam(required = false) String excludeIds,
                                         @RequestParam(required = false) Skill skill) {
        return ResponseEntity.ok(sessionService.nextQuestion(learnerId, parseCsv(excludeIds), skill));
    }

    @GetMapping("/quest")
    public ResponseEntity<List<String>> quest(@PathVariable String learnerId,
                                              @RequestParam(required = false, defaultValue = "5") int count) {
        return ResponseEntity.ok(sessionService.adaptiveQuest(learnerId, count));
    }

    @PostMapping("/answer")
    public ResponseEntity<PracticeAnswerResult> answer(@PathVariable String learnerId, @RequestBody AnswerRequest request) {
        return ResponseEntity.ok(sessionService.submitPracticeAnswer(
                learnerId, request.questionId(), request.answerIndex(), request.responseTimeMs()));
    }

    @GetMapping("/state")
    public ResponseEntity<AdaptiveLearningState> state(@PathVariable String learnerId) {
        return ResponseEntity.ok(sessionService.currentState(learnerId));
    }

    private Set<String> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) return Set.of();
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toSet());
    }

    public record AnswerRequest(String questionId, int answerIndex, long responseTimeMs) {}
}
