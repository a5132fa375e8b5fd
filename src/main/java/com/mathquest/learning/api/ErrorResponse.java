package com.mathquest.learning.api;

import java.time.Instant;

public record ErrorResponse(String error, String message, int status, String path, Instant timestamp) {}
