package com.unitutor.courseware.repository;

import com.unitutor.courseware.model.PageArtifact;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PageArtifactRepository {
    Optional<PageArtifact> find(String documentId, int pageNumber);
    List<String> findSummariesBefore(String documentId, int beforePage, int limit);
    PageArtifact save(String documentId, int pageNumber, String pageType, String body, String summary);
    List<PageArtifact> findAll(String documentId);
    int countByDocument(String documentId);
    int delete(String documentId, Collection<Integer> pageNumbers);
}
