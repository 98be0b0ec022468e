package com.unitutor.courseware.repository;

import com.unitutor.courseware.model.Document;
import com.unitutor.courseware.model.DocumentStatus;

import java.util.List;
import java.util.Optional;

public interface DocumentRepository {
    boolean exists(String id);
    Optional<Document> findById(String id);
    Document upsert(String id, String filename, int totalPages, String filePath);
    void updateStatus(String id, DocumentStatus status, int processedPages);
    void updateSelection(String id, int selectedPages);
    void restoreProgress(Document previous);
    List<String> findStaleProcessing(int staleThresholdMinutes);
    boolean markFailedIfProcessing(String id, int staleThresholdMinutes);
}
