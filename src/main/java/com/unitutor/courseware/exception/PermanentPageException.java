package com.unitutor.courseware.exception;

import lombok.Getter;

@Getter
public class PermanentPageException extends RuntimeException {
    private final int pageNumber;

    public PermanentPageException(int pageNumber, String message) {
        super(message);
        this.pageNumber = pageNumber;
    }

    public PermanentPageException(int pageNumber, String message, Throwable cause) {
        super(message, cause);
        this.pageNumber = pageNumber;
    }
}
