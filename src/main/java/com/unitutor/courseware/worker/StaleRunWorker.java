package com.unitutor.courseware.worker;

import com.unitutor.courseware.config.PipelineProperties;
import com.unitutor.courseware.pipeline.JobRegistry;
import com.unitutor.courseware.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fails documents left in PROCESSING by a run that no longer exists, e.g. after a restart.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StaleRunWorker {

    private final DocumentRepository documentRepository;
    private final JobRegistry jobRegistry;
    private final PipelineProperties pipelineProperties;

    @Scheduled(fixedDelayString = "${app.worker.stale-check-interval-ms:60000}")
    public void failOrphanedRuns() {
        log.debug("Checking for documents stuck in PROCESSING...");

        int thresholdMinutes = pipelineProperties.staleThresholdMinutes();
        List<String> staleIds = documentRepository.findStaleProcessing(thresholdMinutes);
        if (staleIds.isEmpty()) {
            return;
        }

        int failed = 0;
        for (String docId : staleIds) {
            if (jobRegistry.isActive(docId)) {
                continue;
            }
            // the update re-checks staleness, so a run admitted after the isActive check is left alone
            if (documentRepository.markFailedIfProcessing(docId, thresholdMinutes)) {
                failed++;
            }
        }

        if (failed > 0) {
            log.info("Marked {} orphaned runs as FAILED", failed);
        }
    }
}
