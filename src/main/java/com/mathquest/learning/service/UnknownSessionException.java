package com.mathquest.learning.service;

import org.springframework.http.HttpStatus;

public class UnknownSessionException extends LearningApiException {
    public UnknownSessionException(String sessionId) {
        super(HttpStatus.NOT_FOUND, "Assessment session not found: " + sessionId);
    }
}
