package com.unitutor.courseware.controller;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record InvalidateRequest(
    @NotEmpty List<Integer> pages
) {}
