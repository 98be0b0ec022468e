package com.unitutor.courseware.pipeline;

import lombok.Getter;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A run admitted by the {@link JobRegistry}. It counts as running from admission until its
 * attached completion future finishes.
 */
public class JobHandle {

    @Getter
    private final String documentId;

    @Getter
    private final List<Integer> pages;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile CompletableFuture<RunSummary> completion;

    JobHandle(String documentId, List<Integer> pages) {
        this.documentId = documentId;
        this.pages = List.copyOf(pages);
    }

    public void attach(CompletableFuture<RunSummary> completion) {
        this.completion = completion;
    }

    public CompletableFuture<RunSummary> completion() {
        return completion;
    }

    public boolean isRunning() {
        CompletableFuture<RunSummary> current = completion;
        return current == null || !current.isDone();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
