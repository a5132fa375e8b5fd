package com.mathquest.learning.repository;

public class LearnerStateSerializationException extends RuntimeException {
    public LearnerStateSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
