package com.unitutor.courseware.pipeline;

import com.unitutor.courseware.config.PipelineProperties;
import com.unitutor.courseware.repository.PageArtifactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ContextAggregator {

    static final String CONTEXT_HEADER = "\n\nPrevious pages overview:\n";
    static final String SEPARATOR = "\n";

    private final PageArtifactRepository artifactRepository;
    private final PipelineProperties pipelineProperties;

    public String buildContext(String documentId, int pageNumber) {
        return buildContext(documentId, pageNumber, pipelineProperties.contextWindow());
    }

    /**
     * Wraps the summaries of pages {@code max(1, page - window) .. page - 1} in a labelled block.
     * Returns an empty string when none of those pages has a summary.
     */
    public String buildContext(String documentId, int pageNumber, int window) {
        List<String> summaries = artifactRepository.findSummariesBefore(documentId, pageNumber, window);
        if (summaries.isEmpty()) {
            return "";
        }
        return CONTEXT_HEADER + String.join(SEPARATOR, summaries) + "\n";
    }
}
