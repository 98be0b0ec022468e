package com.unitutor.courseware.exception;

import lombok.Getter;

@Getter
public class PageOutOfRangeException extends RuntimeException {
    private final int pageNumber;
    private final int totalPages;

    public PageOutOfRangeException(int pageNumber, int totalPages) {
        super(String.format("Invalid page number %d. Must be between 1 and %d", pageNumber, totalPages));
        this.pageNumber = pageNumber;
        this.totalPages = totalPages;
    }
}
