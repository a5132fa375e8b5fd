package com.mathquest.learning.service;

import org.springframework.http.HttpStatus;

public class LearningApiException extends RuntimeException {
    private final HttpStatus status;

    public LearningApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
