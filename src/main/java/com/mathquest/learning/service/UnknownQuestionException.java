package com.mathquest.learning.service;

import org.springframework.http.HttpStatus;

public class UnknownQuestionException extends LearningApiException {
    public UnknownQuestionException(String questionId) {
        super(HttpStatus.NOT_FOUND, "Question not found: " + questionId);
    }
}
