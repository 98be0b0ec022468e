package com.unitutor.courseware.model;

public enum RunAdmission {
    ACCEPTED,
    ALREADY_RUNNING,
    INVALID_PAGES,
    BUSY
}
