package com.unitutor.courseware.service;

import com.unitutor.courseware.config.StorageProperties;
import com.unitutor.courseware.exception.DocumentNotFoundException;
import com.unitutor.courseware.exception.DocumentNotReadyException;
import com.unitutor.courseware.exception.InvalidDocumentException;
import com.unitutor.courseware.exception.PageOutOfRangeException;
import com.unitutor.courseware.exception.RunInProgressException;
import com.unitutor.courseware.infra.DocumentFileStorage;
import com.unitutor.courseware.infra.DocumentInspector;
import com.unitutor.courseware.model.Document;
import com.unitutor.courseware.model.DocumentInfo;
import com.unitutor.courseware.model.DocumentStatus;
import com.unitutor.courseware.model.PageArtifact;
import com.unitutor.courseware.model.PageArtifactView;
import com.unitutor.courseware.model.ProcessingProgress;
import com.unitutor.courseware.model.SubmitResult;
import com.unitutor.courseware.pipeline.JobRegistry;
import com.unitutor.courseware.repository.DocumentRepository;
import com.unitutor.courseware.repository.PageArtifactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private static final String SUPPORTED_EXTENSION = ".pdf";

    private final DocumentRepository documentRepository;
    private final PageArtifactRepository artifactRepository;
    private final ContentHasher contentHasher;
    private final DocumentInspector documentInspector;
    private final DocumentFileStorage fileStorage;
    private final JobRegistry jobRegistry;
    private final StorageProperties storageProperties;

    @Override
    public SubmitResult submitDocument(byte[] content, String filename) {
        validateUpload(content, filename);

        String documentId = contentHasher.derive(content);
        Optional<Document> existing = documentRepository.findById(documentId);

        if (existing.isPresent() && fileStorage.exists(existing.get().filePath())) {
            Document doc = existing.get();
            log.info("Doc {}: already known, returning cached metadata for {}", documentId, filename);
            return new SubmitResult(documentId, doc.filename(), doc.totalPages(), false);
        }

        if (existing.isPresent()) {
            log.warn("Doc {}: stored file is missing, re-creating it", documentId);
        }

        int totalPages = documentInspector.countPages(content);
        Path location = fileStorage.store(documentId, content);
        Document saved = documentRepository.upsert(documentId, filename, totalPages, location.toString());

        log.info("Doc {}: stored {} with {} pages", documentId, filename, totalPages);
        return new SubmitResult(saved.id(), saved.filename(), saved.totalPages(), existing.isEmpty());
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentInfo getInfo(String documentId) {
        Document doc = findDocument(documentId);
        return new DocumentInfo(
            doc.id(),
            doc.filename(),
            doc.totalPages(),
            doc.uploadedAt(),
            doc.status(),
            doc.processedPages(),
            artifactRepository.countByDocument(documentId)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public ProcessingProgress getProgress(String documentId) {
        return ProcessingProgress.of(findDocument(documentId));
    }

    @Override
    @Transactional(readOnly = true)
    public PageArtifactView getArtifact(String documentId, int pageNumber) {
        Document doc = findDocument(documentId);
        requireInRange(pageNumber, doc.totalPages());

        return artifactRepository.find(documentId, pageNumber)
            .map(PageArtifactView::ready)
            .orElseGet(() -> {
                log.debug("Doc {}: page {} not generated yet", documentId, pageNumber);
                return PageArtifactView.pending(documentId, pageNumber);
            });
    }

    @Override
    @Transactional(readOnly = true)
    public List<PageArtifact> exportAll(String documentId) {
        Document doc = findDocument(documentId);
        if (doc.status() != DocumentStatus.COMPLETED) {
            throw new DocumentNotReadyException(documentId, doc.status());
        }
        return artifactRepository.findAll(documentId);
    }

    @Override
    @Transactional(readOnly = true)
    public String exportMarkdown(String documentId) {
        Document doc = findDocument(documentId);
        List<PageArtifact> artifacts = exportAll(documentId);

        StringBuilder markdown = new StringBuilder()
            .append("# ").append(doc.filename()).append("\n\n");

        for (int i = 0; i < artifacts.size(); i++) {
            PageArtifact artifact = artifacts.get(i);
            if (i > 0) {
                markdown.append("\n\n---\n\n");
            }
            markdown.append("## Page ").append(artifact.pageNumber()).append("\n\n")
                .append(artifact.body().strip());
        }
        return markdown.append("\n").toString();
    }

    @Override
    public int invalidate(String documentId, List<Integer> pageNumbers) {
        Document doc = findDocument(documentId);

        if (jobRegistry.isActive(documentId)) {
            throw new RunInProgressException(documentId);
        }

        Set<Integer> pages = new TreeSet<>();
        if (pageNumbers != null) {
            for (Integer page : pageNumbers) {
                requireInRange(page == null ? 0 : page, doc.totalPages());
                pages.add(page);
            }
        }

        int removed = artifactRepository.delete(documentId, pages);
        log.info("Doc {}: invalidated {} cached pages out of {} requested", documentId, removed, pages.size());
        return removed;
    }

    private Document findDocument(String documentId) {
        return documentRepository.findById(documentId)
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", documentId);
                return new DocumentNotFoundException(documentId);
            });
    }

    private void validateUpload(byte[] content, String filename) {
        if (filename == null || !filename.toLowerCase().endsWith(SUPPORTED_EXTENSION)) {
            throw new InvalidDocumentException("Only PDF files are supported");
        }
        if (content == null || content.length == 0) {
            throw new InvalidDocumentException("Uploaded file is empty");
        }
        if (content.length > storageProperties.maxFileSizeBytes()) {
            throw new InvalidDocumentException(
                String.format("File too large. Max size: %dMB", storageProperties.maxFileSizeMb()));
        }
    }

    private static void requireInRange(int pageNumber, int totalPages) {
        if (pageNumber < 1 || pageNumber > totalPages) {
            throw new PageOutOfRangeException(pageNumber, totalPages);
        }
    }
}
