package com.unitutor.courseware.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.unitutor.courseware.config.PipelineProperties;
import com.unitutor.courseware.exception.DocumentNotFoundException;
import com.unitutor.courseware.exception.PermanentPageException;
import com.unitutor.courseware.model.Document;
import com.unitutor.courseware.model.DocumentStatus;
import com.unitutor.courseware.model.GeneratorConfig;
import com.unitutor.courseware.model.OutputFormat;
import com.unitutor.courseware.model.PageArtifact;
import com.unitutor.courseware.repository.DocumentRepository;
import com.unitutor.courseware.repository.PageArtifactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Walks one document's selected pages in ascending order. Cached pages are counted and skipped,
 * missing ones are rendered, generated and stored. A failing page is left uncached for the next
 * run; only store failures abort the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

    private record GeneratedPage(String pageType, String body, String summary) {}

    private final DocumentRepository documentRepository;
    private final PageArtifactRepository artifactRepository;
    private final ContextAggregator contextAggregator;
    private final SummaryExtractor summaryExtractor;
    private final PageRasterizer rasterizer;
    private final PageGenerator generator;
    private final JobRegistry jobRegistry;
    private final PipelineProperties pipelineProperties;

    public RunSummary run(JobHandle handle, GeneratorConfig config) {
        String docId = handle.getDocumentId();
        GeneratorConfig effectiveConfig = config != null ? config : GeneratorConfig.defaults();
        List<Integer> pages = handle.getPages();

        int recorded = 0;
        int cached = 0;
        int generated = 0;
        int skipped = 0;

        log.info("Doc {}: starting run over {} pages", docId, pages.size());

        try {
            Document document = documentRepository.findById(docId)
                .orElseThrow(() -> new DocumentNotFoundException(docId));

            documentRepository.updateStatus(docId, DocumentStatus.PROCESSING, 0);

            for (int i = 0; i < pages.size(); i++) {
                int page = pages.get(i);

                if (handle.isCancelled()) {
                    log.info("Doc {}: run cancelled before page {}", docId, page);
                    documentRepository.updateStatus(docId, DocumentStatus.FAILED, recorded);
                    return new RunSummary(docId, cached, generated, skipped, true, DocumentStatus.FAILED);
                }

                PageOutcome outcome = processPage(document, page, effectiveConfig);

                switch (outcome) {
                    case CACHED -> cached++;
                    case GENERATED -> generated++;
                    case SKIPPED -> skipped++;
                }

                if (outcome != PageOutcome.SKIPPED) {
                    documentRepository.updateStatus(docId, DocumentStatus.PROCESSING, recorded + 1);
                    recorded++;
                }

                boolean morePages = i < pages.size() - 1;
                if (outcome != PageOutcome.CACHED && morePages && !pauseBetweenPages()) {
                    log.info("Doc {}: interrupted after page {}", docId, page);
                    documentRepository.updateStatus(docId, DocumentStatus.FAILED, recorded);
                    return new RunSummary(docId, cached, generated, skipped, true, DocumentStatus.FAILED);
                }
            }

            documentRepository.updateStatus(docId, DocumentStatus.COMPLETED, recorded);
            log.info("Doc {}: run completed, {} cached, {} generated, {} skipped", docId, cached, generated, skipped);
            return new RunSummary(docId, cached, generated, skipped, false, DocumentStatus.COMPLETED);

        } catch (Exception e) {
            log.error("Doc {}: run FAILED after {} processed pages: {}", docId, recorded, e.getMessage(), e);
            markFailed(docId, recorded);
            return new RunSummary(docId, cached, generated, skipped, false, DocumentStatus.FAILED);
        } finally {
            jobRegistry.release(docId, handle);
        }
    }

    private PageOutcome processPage(Document document, int page, GeneratorConfig config) {
        String docId = document.id();

        if (artifactRepository.find(docId, page).isPresent()) {
            log.debug("Doc {}: page {} served from cache", docId, page);
            return PageOutcome.CACHED;
        }

        try {
            GeneratedPage result = generatePage(document, page, config);
            artifactRepository.save(docId, page, result.pageType(), result.body(), result.summary());
            log.info("Doc {}: page {} generated and cached", docId, page);
            return PageOutcome.GENERATED;
        } catch (DataAccessException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Doc {}: page {} skipped: {}", docId, page, e.getMessage());
            return PageOutcome.SKIPPED;
        }
    }

    private GeneratedPage generatePage(Document document, int page, GeneratorConfig config) {
        byte[] image = rasterizer.render(Path.of(document.filePath()), page);
        String context = contextAggregator.buildContext(document.id(), page);
        OutputFormat format = config.outputFormatOrDefault();

        GenerationRequest request = new GenerationRequest(
            page,
            image,
            PagePrompts.forPage(page, format),
            context,
            config.temperature() != null ? config.temperature() : pipelineProperties.temperature(),
            config.maxOutputTokens() != null ? config.maxOutputTokens() : pipelineProperties.maxOutputTokens(),
            config
        );

        String raw = generator.generate(request);
        if (raw == null || raw.isBlank()) {
            throw new PermanentPageException(page, "Generator returned no text for page " + page);
        }

        return format == OutputFormat.STRUCTURED
            ? fromStructured(page, raw)
            : new GeneratedPage(PageArtifact.DEFAULT_PAGE_TYPE, raw, summaryExtractor.summarize(page, raw));
    }

    private GeneratedPage fromStructured(int page, String raw) {
        JsonNode node = StructuredOutputRepair.parse(raw);

        String pageType = textField(node, StructuredOutputRepair.PAGE_TYPE_FIELD);
        String summaryField = textField(node, "summary");
        String rawText = textField(node, StructuredOutputRepair.RAW_TEXT_FIELD);

        String summary = summaryField != null
            ? summaryExtractor.summarize(page, summaryField)
            : summaryExtractor.summarize(page, rawText != null ? rawText : raw);

        return new GeneratedPage(
            pageType != null ? pageType : PageArtifact.DEFAULT_PAGE_TYPE,
            node.toPrettyString(),
            summary
        );
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private boolean pauseBetweenPages() {
        long delayMs = pipelineProperties.pageDelay().toMillis();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void markFailed(String docId, int processed) {
        try {
            documentRepository.updateStatus(docId, DocumentStatus.FAILED, processed);
        } catch (Exception e) {
            log.error("Doc {}: could not record FAILED status: {}", docId, e.getMessage());
        }
    }
}
