package com.unitutor.courseware.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
