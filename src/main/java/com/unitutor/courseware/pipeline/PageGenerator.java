package com.unitutor.courseware.pipeline;

public interface PageGenerator {

    /**
     * Produces the raw explanation text for one page. The text may be empty or truncated;
     * content-policy refusals come back as text rather than as an exception.
     */
    String generate(GenerationRequest request);
}
