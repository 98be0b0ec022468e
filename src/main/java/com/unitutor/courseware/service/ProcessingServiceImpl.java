package com.unitutor.courseware.service;

import com.unitutor.courseware.exception.DocumentNotFoundException;
import com.unitutor.courseware.model.Document;
import com.unitutor.courseware.model.GeneratorConfig;
import com.unitutor.courseware.model.RunAdmission;
import com.unitutor.courseware.pipeline.JobHandle;
import com.unitutor.courseware.pipeline.JobRegistry;
import com.unitutor.courseware.pipeline.PipelineRunner;
import com.unitutor.courseware.pipeline.RunSummary;
import com.unitutor.courseware.repository.DocumentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class ProcessingServiceImpl implements ProcessingService {

    private final DocumentRepository documentRepository;
    private final JobRegistry jobRegistry;
    private final PipelineRunner pipelineRunner;
    private final Executor pipelineTaskExecutor;

    public ProcessingServiceImpl(
        DocumentRepository documentRepository,
        JobRegistry jobRegistry,
        PipelineRunner pipelineRunner,
        @Qualifier("pipelineTaskExecutor") Executor pipelineTaskExecutor
    ) {
        this.documentRepository = documentRepository;
        this.jobRegistry = jobRegistry;
        this.pipelineRunner = pipelineRunner;
        this.pipelineTaskExecutor = pipelineTaskExecutor;
    }

    @Override
    public RunAdmission startRun(String documentId, List<Integer> pageNumbers, GeneratorConfig generatorConfig) {
        Document document = documentRepository.findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));

        Optional<List<Integer>> pages = normalizePages(pageNumbers, document.totalPages());
        if (pages.isEmpty()) {
            log.warn("Doc {}: rejected run with invalid pages {}", documentId, pageNumbers);
            return RunAdmission.INVALID_PAGES;
        }

        Optional<JobHandle> admitted = jobRegistry.admit(documentId, pages.get());
        if (admitted.isEmpty()) {
            log.warn("Doc {}: run already in progress, rejecting new run", documentId);
            return RunAdmission.ALREADY_RUNNING;
        }

        JobHandle handle = admitted.get();
        GeneratorConfig config = generatorConfig != null ? generatorConfig : GeneratorConfig.defaults();

        try {
            documentRepository.updateSelection(documentId, pages.get().size());
            CompletableFuture<RunSummary> completion =
                CompletableFuture.supplyAsync(() -> pipelineRunner.run(handle, config), pipelineTaskExecutor);
            handle.attach(completion);
        } catch (TaskRejectedException e) {
            log.warn("Doc {}: no pipeline capacity left, rejecting run", documentId);
            documentRepository.restoreProgress(document);
            jobRegistry.release(documentId, handle);
            return RunAdmission.BUSY;
        } catch (RuntimeException e) {
            jobRegistry.release(documentId, handle);
            throw e;
        }

        log.info("Doc {}: run accepted for {} pages", documentId, pages.get().size());
        return RunAdmission.ACCEPTED;
    }

    @Override
    public boolean cancelRun(String documentId) {
        if (!documentRepository.exists(documentId)) {
            throw new DocumentNotFoundException(documentId);
        }
        return jobRegistry.cancel(documentId);
    }

    @Override
    public boolean isRunning(String documentId) {
        return jobRegistry.isActive(documentId);
    }

    /**
     * Sorted, de-duplicated pages, or empty when the selection is empty or leaves {@code [1, totalPages]}.
     */
    static Optional<List<Integer>> normalizePages(List<Integer> pageNumbers, int totalPages) {
        if (pageNumbers == null || pageNumbers.isEmpty()) {
            return Optional.empty();
        }
        boolean allInRange = pageNumbers.stream()
            .allMatch(page -> page != null && page >= 1 && page <= totalPages);
        if (!allInRange) {
            return Optional.empty();
        }
        return Optional.of(pageNumbers.stream().distinct().sorted().toList());
    }
}
