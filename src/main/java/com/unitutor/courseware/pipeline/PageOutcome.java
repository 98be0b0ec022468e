package com.unitutor.courseware.pipeline;

public enum PageOutcome {
    CACHED,
    GENERATED,
    SKIPPED
}
