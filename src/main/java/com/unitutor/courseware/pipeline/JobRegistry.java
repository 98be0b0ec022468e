package com.unitutor.courseware.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-wide map of documents to their live run. Admission and release go through
 * {@link ConcurrentHashMap#compute}, which serialises them per document.
 */
@Slf4j
@Component
public class JobRegistry {

    private final ConcurrentHashMap<String, JobHandle> jobs = new ConcurrentHashMap<>();

    public Optional<JobHandle> admit(String documentId, List<Integer> pages) {
        JobHandle candidate = new JobHandle(documentId, pages);

        JobHandle current = jobs.compute(documentId, (id, existing) ->
            existing != null && existing.isRunning() ? existing : candidate);

        if (current != candidate) {
            log.debug("Doc {}: admission rejected, a run is already active", documentId);
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    public boolean isActive(String documentId) {
        JobHandle handle = jobs.get(documentId);
        return handle != null && handle.isRunning();
    }

    public Optional<JobHandle> find(String documentId) {
        return Optional.ofNullable(jobs.get(documentId));
    }

    public boolean cancel(String documentId) {
        JobHandle handle = jobs.get(documentId);
        if (handle == null || !handle.isRunning()) {
            return false;
        }
        handle.cancel();
        log.info("Doc {}: cancellation requested", documentId);
        return true;
    }

    public void release(String documentId, JobHandle handle) {
        if (jobs.remove(documentId, handle)) {
            log.debug("Doc {}: run released", documentId);
        }
    }

    public Set<String> activeDocumentIds() {
        return jobs.entrySet().stream()
            .filter(entry -> entry.getValue().isRunning())
            .map(java.util.Map.Entry::getKey)
            .collect(Collectors.toSet());
    }
}
