package com.unitutor.courseware.exception;

import lombok.Getter;

/**
 * Thrown once the generator kept failing with retriable errors (rate limits, timeouts, 5xx)
 * and the local retry budget is spent.
 */
@Getter
public class TransientGenerationException extends RuntimeException {
    private final int pageNumber;

    public TransientGenerationException(int pageNumber, Throwable cause) {
        super("Generation for page " + pageNumber + " kept failing: " + cause.getMessage(), cause);
        this.pageNumber = pageNumber;
    }
}
