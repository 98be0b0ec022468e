package com.unitutor.courseware.infra;

public interface DocumentInspector {

    /**
     * Counts the pages of a document, rejecting bytes that are not a readable document.
     */
    int countPages(byte[] content);
}
