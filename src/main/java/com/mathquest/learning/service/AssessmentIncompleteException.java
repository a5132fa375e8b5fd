package com.mathquest.learning.service;

import org.springframework.http.HttpStatus;

public class AssessmentIncompleteException extends LearningApiException {
    public AssessmentIncompleteException(String learnerId) {
        super(HttpStatus.CONFLICT, "No completed assessment for learner: " + learnerId);
    }
}
