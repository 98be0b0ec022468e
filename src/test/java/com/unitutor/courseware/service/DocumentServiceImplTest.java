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
import com.unitutor.courseware.model.DocumentStatus;
import com.unitutor.courseware.model.PageArtifact;
import com.unitutor.courseware.model.PageArtifactView;
import com.unitutor.courseware.model.ProcessingProgress;
import com.unitutor.courseware.model.SubmitResult;
import com.unitutor.courseware.pipeline.JobRegistry;
import com.unitutor.courseware.repository.DocumentRepository;
import com.unitutor.courseware.repository.PageArtifactRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentServiceImplTest {

    private static final byte[] PDF_BYTES = "%PDF-1.7 lecture".getBytes(StandardCharsets.UTF_8);

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private PageArtifactRepository artifactRepository;

    @Mock
    private DocumentInspector documentInspector;

    @Mock
    private DocumentFileStorage fileStorage;

    private final ContentHasher contentHasher = new ContentHasher();
    private JobRegistry jobRegistry;
    private DocumentServiceImpl documentService;
    private String docId;

    @BeforeEach
    void setUp() {
        jobRegistry = new JobRegistry();
        documentService = new DocumentServiceImpl(
            documentRepository,
            artifactRepository,
            contentHasher,
            documentInspector,
            fileStorage,
            jobRegistry,
            new StorageProperties("/tmp/uploads", 1, 200)
        );
        docId = contentHasher.derive(PDF_BYTES);
    }

    @Nested
    @DisplayName("submitDocument")
    class Submit {

        @Test
        @DisplayName("New content is inspected, stored and recorded")
        void shouldStoreNewDocument() {
            Path stored = Path.of("/tmp/uploads/" + docId + ".pdf");
            when(documentRepository.findById(docId)).thenReturn(Optional.empty());
            when(documentInspector.countPages(PDF_BYTES)).thenReturn(12);
            when(fileStorage.store(docId, PDF_BYTES)).thenReturn(stored);
            when(documentRepository.upsert(docId, "calculus.pdf", 12, stored.toString()))
                .thenReturn(document(docId, 12, DocumentStatus.PENDING, 0, 0));

            SubmitResult result = documentService.submitDocument(PDF_BYTES, "calculus.pdf");

            assertThat(result.documentId()).isEqualTo(docId);
            assertThat(result.totalPages()).isEqualTo(12);
            assertThat(result.created()).isTrue();
        }

        @Test
        @DisplayName("Re-uploading known content returns the existing record untouched")
        void shouldReturnExistingDocument() {
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 12, DocumentStatus.COMPLETED, 12, 12)));
            when(fileStorage.exists(anyString())).thenReturn(true);

            SubmitResult result = documentService.submitDocument(PDF_BYTES, "renamed.pdf");

            assertThat(result.created()).isFalse();
            assertThat(result.filename()).isEqualTo("calculus.pdf");
            verifyNoInteractions(documentInspector);
            verify(fileStorage, never()).store(any(), any());
            verify(documentRepository, never()).upsert(any(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("A known record whose file vanished is stored again but not reported as created")
        void shouldRestoreMissingFile() {
            Path stored = Path.of("/tmp/uploads/" + docId + ".pdf");
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 12, DocumentStatus.COMPLETED, 12, 12)));
            when(fileStorage.exists(anyString())).thenReturn(false);
            when(documentInspector.countPages(PDF_BYTES)).thenReturn(12);
            when(fileStorage.store(docId, PDF_BYTES)).thenReturn(stored);
            when(documentRepository.upsert(eq(docId), any(), eq(12), any()))
                .thenReturn(document(docId, 12, DocumentStatus.PENDING, 0, 0));

            SubmitResult result = documentService.submitDocument(PDF_BYTES, "calculus.pdf");

            assertThat(result.created()).isFalse();
            verify(fileStorage).store(docId, PDF_BYTES);
        }

        @Test
        @DisplayName("Wrong extension, empty and oversized uploads are rejected")
        void shouldRejectInvalidUploads() {
            assertThatThrownBy(() -> documentService.submitDocument(PDF_BYTES, "notes.docx"))
                .isInstanceOf(InvalidDocumentException.class)
                .hasMessageContaining("PDF");
            assertThatThrownBy(() -> documentService.submitDocument(new byte[0], "notes.pdf"))
                .isInstanceOf(InvalidDocumentException.class)
                .hasMessageContaining("empty");
            assertThatThrownBy(() -> documentService.submitDocument(new byte[1024 * 1024 + 1], "big.PDF"))
                .isInstanceOf(InvalidDocumentException.class)
                .hasMessageContaining("1MB");

            verifyNoInteractions(documentRepository, fileStorage, documentInspector);
        }
    }

    @Test
    @DisplayName("Progress is derived from the stored counters")
    void shouldReportProgress() {
        when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 10, DocumentStatus.PROCESSING, 1, 3)));

        ProcessingProgress progress = documentService.getProgress(docId);

        assertThat(progress.totalSelected()).isEqualTo(3);
        assertThat(progress.processed()).isEqualTo(1);
        assertThat(progress.percent()).isEqualTo(33.3);
        assertThat(progress.status()).isEqualTo(DocumentStatus.PROCESSING);
    }

    @Test
    @DisplayName("Info view includes the number of cached pages")
    void shouldReportInfo() {
        when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 10, DocumentStatus.COMPLETED, 4, 4)));
        when(artifactRepository.countByDocument(docId)).thenReturn(6);

        var info = documentService.getInfo(docId);

        assertThat(info.filename()).isEqualTo("calculus.pdf");
        assertThat(info.totalPages()).isEqualTo(10);
        assertThat(info.processedPages()).isEqualTo(4);
        assertThat(info.cachedPages()).isEqualTo(6);
    }

    @Test
    @DisplayName("Unknown identity raises not found")
    void shouldThrowForUnknownDocument() {
        when(documentRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> documentService.getProgress("nope"))
            .isInstanceOf(DocumentNotFoundException.class);
    }

    @Nested
    @DisplayName("getArtifact")
    class Artifact {

        @Test
        @DisplayName("Cached page is returned as ready")
        void shouldReturnReadyArtifact() {
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 3, DocumentStatus.COMPLETED, 3, 3)));
            when(artifactRepository.find(docId, 2)).thenReturn(Optional.of(artifact(docId, 2)));

            PageArtifactView view = documentService.getArtifact(docId, 2);

            assertThat(view.ready()).isTrue();
            assertThat(view.body()).isEqualTo("Body of page 2");
        }

        @Test
        @DisplayName("Missing page yields a pending placeholder")
        void shouldReturnPendingPlaceholder() {
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 3, DocumentStatus.PROCESSING, 1, 3)));
            when(artifactRepository.find(docId, 3)).thenReturn(Optional.empty());

            PageArtifactView view = documentService.getArtifact(docId, 3);

            assertThat(view.ready()).isFalse();
            assertThat(view.body()).isNull();
        }

        @Test
        @DisplayName("Page outside the document is rejected")
        void shouldRejectOutOfRangePage() {
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 3, DocumentStatus.PENDING, 0, 0)));

            assertThatThrownBy(() -> documentService.getArtifact(docId, 4))
                .isInstanceOf(PageOutOfRangeException.class);
        }
    }

    @Nested
    @DisplayName("export")
    class Export {

        @Test
        @DisplayName("Export requires a completed run")
        void shouldRequireCompletedStatus() {
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 3, DocumentStatus.PROCESSING, 1, 3)));

            assertThatThrownBy(() -> documentService.exportAll(docId))
                .isInstanceOf(DocumentNotReadyException.class);
        }

        @Test
        @DisplayName("Markdown export has a heading per page and separators between pages")
        void shouldRenderMarkdown() {
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 3, DocumentStatus.COMPLETED, 2, 2)));
            when(artifactRepository.findAll(docId)).thenReturn(List.of(artifact(docId, 1), artifact(docId, 3)));

            String markdown = documentService.exportMarkdown(docId);

            assertThat(markdown).isEqualTo("""
                # calculus.pdf

                ## Page 1

                Body of page 1

                ---

                ## Page 3

                Body of page 3
                """);
        }
    }

    @Nested
    @DisplayName("invalidate")
    class Invalidate {

        @Test
        @DisplayName("Selected pages are dropped from the cache")
        void shouldDeletePages() {
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 3, DocumentStatus.COMPLETED, 3, 3)));
            when(artifactRepository.delete(docId, Set.of(2))).thenReturn(1);

            assertThat(documentService.invalidate(docId, List.of(2, 2))).isEqualTo(1);
        }

        @Test
        @DisplayName("Invalidation is refused while a run is active")
        void shouldRefuseDuringRun() {
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 3, DocumentStatus.PROCESSING, 0, 3)));
            jobRegistry.admit(docId, List.of(1));

            assertThatThrownBy(() -> documentService.invalidate(docId, List.of(1)))
                .isInstanceOf(RunInProgressException.class);
            verifyNoInteractions(artifactRepository);
        }

        @Test
        @DisplayName("Out-of-range pages are rejected before anything is deleted")
        void shouldRejectOutOfRangePages() {
            when(documentRepository.findById(docId)).thenReturn(Optional.of(document(docId, 3, DocumentStatus.COMPLETED, 3, 3)));

            assertThatThrownBy(() -> documentService.invalidate(docId, List.of(1, 9)))
                .isInstanceOf(PageOutOfRangeException.class);
            verifyNoInteractions(artifactRepository);
        }
    }

    private static Document document(String id, int totalPages, DocumentStatus status, int processed, int selected) {
        return new Document(id, "calculus.pdf", totalPages, "/tmp/uploads/" + id + ".pdf",
            status, processed, selected, OffsetDateTime.now(), OffsetDateTime.now());
    }

    private static PageArtifact artifact(String id, int page) {
        return new PageArtifact(id, page, "CONTENT", "Body of page " + page, "[Page " + page + " summary] Body", OffsetDateTime.now());
    }
}
