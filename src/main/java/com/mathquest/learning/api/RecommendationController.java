package com.mathquest.learning.api;

import com.mathquest.learning.recommendation.RecommendationModels.LearnerOverview;
import com.mathquest.learning.service.LearnerSessionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {
    private final LearnerSessionService sessionService;

    public RecommendationController(LearnerSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping("/{learnerId}")
    public ResponseEntity<LearnerOverview> overview(@PathVariable String learnerId) {
        return ResponseEntity.ok(sessionService.recommendations(learnerId));
    }
}
