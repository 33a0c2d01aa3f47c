package com.project.image.grainstats.exceptions;

/** Domain-specific exception for malformed grain statistics input and processing failures. */
public class GrainStatsException extends RuntimeException {
    public GrainStatsException(String message) { super(message); }
    public GrainStatsException(String message, Throwable cause) { super(message, cause); }
}
