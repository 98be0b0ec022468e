package com.unitutor.courseware.model;

public enum OutputFormat {
    MARKDOWN,
    STRUCTURED
}
