package com.unitutor.courseware;

import com.unitutor.courseware.exception.DocumentNotReadyException;
import com.unitutor.courseware.infra.PdfFixtures;
import com.unitutor.courseware.model.DocumentStatus;
import com.unitutor.courseware.model.PageArtifact;
import com.unitutor.courseware.model.ProcessingProgress;
import com.unitutor.courseware.model.RunAdmission;
import com.unitutor.courseware.model.SubmitResult;
import com.unitutor.courseware.pipeline.GenerationRequest;
import com.unitutor.courseware.pipeline.PageGenerator;
import com.unitutor.courseware.pipeline.PageRasterizer;
import com.unitutor.courseware.repository.BaseIntegrationTest;
import com.unitutor.courseware.service.DocumentService;
import com.unitutor.courseware.service.ProcessingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CoursewarePipelineScenarioTest extends BaseIntegrationTest {

    @Autowired
    private DocumentService documentService;

    @Autowired
    private ProcessingService processingService;

    @Autowired
    private JdbcClient jdbcClient;

    @MockitoBean
    private PageRasterizer rasterizer;

    @MockitoBean
    private PageGenerator generator;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("DELETE FROM pdf_documents").update();
        when(rasterizer.render(any(Path.class), anyInt())).thenReturn(new byte[]{1, 2, 3});
        when(generator.generate(any())).thenAnswer(invocation -> {
            GenerationRequest request = invocation.getArgument(0);
            return "## Page " + request.pageNumber() + "\nExplanation of page " + request.pageNumber();
        });
    }

    @Test
    @DisplayName("Three pages are generated once, served from cache afterwards and regenerated only when invalidated")
    void shouldCacheAndInvalidatePages() {
        byte[] pdf = PdfFixtures.pdfWithPages(3);

        // 1. first upload and run generates every page
        SubmitResult submitted = documentService.submitDocument(pdf, "algebra.pdf");
        assertThat(submitted.created()).isTrue();
        assertThat(submitted.totalPages()).isEqualTo(3);
        String docId = submitted.documentId();

        assertThat(processingService.startRun(docId, List.of(1, 2, 3), null)).isEqualTo(RunAdmission.ACCEPTED);
        waitForRunToFinish(docId);

        ProcessingProgress progress = documentService.getProgress(docId);
        assertThat(progress.status()).isEqualTo(DocumentStatus.COMPLETED);
        assertThat(progress.processed()).isEqualTo(3);
        assertThat(progress.percent()).isEqualTo(100.0);

        ArgumentCaptor<GenerationRequest> requests = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generator, times(3)).generate(requests.capture());
        assertThat(requests.getAllValues()).extracting(GenerationRequest::pageNumber).containsExactly(1, 2, 3);
        assertThat(requests.getAllValues().get(0).context()).isEmpty();
        assertThat(requests.getAllValues().get(2).context())
            .contains("Previous pages overview:")
            .contains("[Page 1 summary] Explanation of page 1")
            .contains("[Page 2 summary] Explanation of page 2");

        // 2. same bytes again: same identity, everything cached
        SubmitResult again = documentService.submitDocument(pdf, "algebra-copy.pdf");
        assertThat(again.documentId()).isEqualTo(docId);
        assertThat(again.created()).isFalse();

        assertThat(processingService.startRun(docId, List.of(1, 2, 3), null)).isEqualTo(RunAdmission.ACCEPTED);
        waitForRunToFinish(docId);

        verify(generator, times(3)).generate(any());
        verify(rasterizer, times(3)).render(any(Path.class), anyInt());
        assertThat(documentService.getProgress(docId).processed()).isEqualTo(3);

        // 3. invalidating page 2 regenerates only that page
        assertThat(documentService.invalidate(docId, List.of(2))).isEqualTo(1);
        assertThat(documentService.getArtifact(docId, 2).ready()).isFalse();

        assertThat(processingService.startRun(docId, List.of(1, 2, 3), null)).isEqualTo(RunAdmission.ACCEPTED);
        waitForRunToFinish(docId);

        verify(generator, times(4)).generate(any());
        verify(generator, times(2)).generate(argThat(request -> request.pageNumber() == 2));

        List<PageArtifact> exported = documentService.exportAll(docId);
        assertThat(exported).extracting(PageArtifact::pageNumber).containsExactly(1, 2, 3);
        assertThat(documentService.exportMarkdown(docId))
            .startsWith("# algebra.pdf")
            .contains("## Page 3");
    }

    @Test
    @DisplayName("A second run for the same document is rejected while the first is still working")
    void shouldAllowAtMostOneRunPerDocument() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return "Explanation";
        }).when(generator).generate(any());

        String docId = documentService.submitDocument(PdfFixtures.pdfWithPages(2), "physics.pdf").documentId();

        assertThat(processingService.startRun(docId, List.of(1, 2), null)).isEqualTo(RunAdmission.ACCEPTED);
        assertThat(processingService.startRun(docId, List.of(1), null)).isEqualTo(RunAdmission.ALREADY_RUNNING);
        assertThat(processingService.isRunning(docId)).isTrue();

        release.countDown();
        waitForRunToFinish(docId);

        assertThat(documentService.getProgress(docId).status()).isEqualTo(DocumentStatus.COMPLETED);

        // a re-run reports PROCESSING from the moment it is accepted, not the finished run's status
        CountDownLatch rerunRelease = new CountDownLatch(1);
        doAnswer(invocation -> {
            rerunRelease.await(10, TimeUnit.SECONDS);
            return "Explanation";
        }).when(generator).generate(any());
        documentService.invalidate(docId, List.of(1));

        assertThat(processingService.startRun(docId, List.of(1), null)).isEqualTo(RunAdmission.ACCEPTED);
        ProcessingProgress rerun = documentService.getProgress(docId);
        assertThat(rerun.status()).isEqualTo(DocumentStatus.PROCESSING);
        assertThat(rerun.processed()).isZero();
        assertThatThrownBy(() -> documentService.exportAll(docId)).isInstanceOf(DocumentNotReadyException.class);

        rerunRelease.countDown();
        waitForRunToFinish(docId);
        assertThat(documentService.getProgress(docId).status()).isEqualTo(DocumentStatus.COMPLETED);
    }

    @Test
    @DisplayName("A page that keeps failing is left pending while the rest of the run completes")
    void shouldSkipFailingPage() {
        doThrow(new IllegalStateException("model refused"))
            .when(generator).generate(argThat(request -> request != null && request.pageNumber() == 2));

        String docId = documentService.submitDocument(PdfFixtures.pdfWithPages(3), "chemistry.pdf").documentId();

        processingService.startRun(docId, List.of(1, 2, 3), null);
        waitForRunToFinish(docId);

        ProcessingProgress progress = documentService.getProgress(docId);
        assertThat(progress.status()).isEqualTo(DocumentStatus.COMPLETED);
        assertThat(progress.processed()).isEqualTo(2);
        assertThat(documentService.getArtifact(docId, 2).ready()).isFalse();
        assertThat(documentService.getArtifact(docId, 3).ready()).isTrue();
    }

    private void waitForRunToFinish(String docId) {
        await()
            .atMost(20, TimeUnit.SECONDS)
            .pollInterval(100, TimeUnit.MILLISECONDS)
            .until(() -> !processingService.isRunning(docId));
    }
}
