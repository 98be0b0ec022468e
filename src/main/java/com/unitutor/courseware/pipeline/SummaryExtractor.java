package com.unitutor.courseware.pipeline;

import com.unitutor.courseware.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the short page summary that later pages receive as context.
 */
@Component
@RequiredArgsConstructor
public class SummaryExtractor {

    private final PipelineProperties pipelineProperties;

    public String summarize(int pageNumber, String text) {
        int maxChars = pipelineProperties.summaryMaxChars();
        List<String> picked = new ArrayList<>();
        int charCount = 0;

        if (text != null) {
            for (String line : text.split("\n")) {
                if (charCount > maxChars) {
                    break;
                }
                if (!line.isBlank() && !line.startsWith("#")) {
                    picked.add(line.strip());
                    charCount += line.length();
                }
            }
        }

        String joined = String.join(" ", picked);
        if (joined.length() > maxChars) {
            joined = joined.substring(0, maxChars);
        }
        return "[Page " + pageNumber + " summary] " + joined;
    }
}
