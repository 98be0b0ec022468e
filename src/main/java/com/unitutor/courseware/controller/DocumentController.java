package com.unitutor.courseware.controller;

import com.unitutor.courseware.exception.InvalidDocumentException;
import com.unitutor.courseware.model.RunAdmission;
import com.unitutor.courseware.service.DocumentService;
import com.unitutor.courseware.service.ProcessingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

    private static final MediaType TEXT_MARKDOWN = new MediaType("text", "markdown", StandardCharsets.UTF_8);

    private final DocumentService documentService;
    private final ProcessingService processingService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(@RequestParam("file") MultipartFile file) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new InvalidDocumentException("Could not read uploaded file", e);
        }

        var result = documentService.submitDocument(content, file.getOriginalFilename());
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(UploadResponse.from(result));
    }

    @GetMapping("/pdf/{id}/info")
    public ResponseEntity<DocumentInfoResponse> getInfo(@PathVariable String id) {
        return ResponseEntity.ok(DocumentInfoResponse.from(documentService.getInfo(id)));
    }

    @PostMapping("/pdf/{id}/runs")
    public ResponseEntity<RunResponse> startRun(
        @PathVariable String id,
        @Valid @RequestBody StartRunRequest request) {

        RunAdmission admission = processingService.startRun(id, request.selectedPages(), request.toGeneratorConfig());

        return switch (admission) {
            case ACCEPTED -> ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new RunResponse(id, admission, "Processing started"));
            case ALREADY_RUNNING -> ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new RunResponse(id, admission, "Document is already being processed"));
            case INVALID_PAGES -> ResponseEntity.badRequest()
                .body(new RunResponse(id, admission, "Selected pages are empty or out of range"));
            case BUSY -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new RunResponse(id, admission, "Too many runs in progress, retry later"));
        };
    }

    @DeleteMapping("/pdf/{id}/runs")
    public ResponseEntity<RunResponse> cancelRun(@PathVariable String id) {
        if (processingService.cancelRun(id)) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new RunResponse(id, null, "Cancellation requested"));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new RunResponse(id, null, "No active run for this document"));
    }

    @GetMapping("/progress/{id}")
    public ResponseEntity<ProgressResponse> getProgress(@PathVariable String id) {
        var progress = documentService.getProgress(id);
        return ResponseEntity.ok(ProgressResponse.from(progress, processingService.isRunning(id)));
    }

    @GetMapping("/explain/{id}/{page}")
    public ResponseEntity<ExplanationResponse> getExplanation(@PathVariable String id, @PathVariable int page) {
        return ResponseEntity.ok(ExplanationResponse.from(documentService.getArtifact(id, page)));
    }

    @GetMapping("/export/{id}")
    public ResponseEntity<List<ExplanationResponse>> exportAll(@PathVariable String id) {
        List<ExplanationResponse> pages = documentService.exportAll(id).stream()
            .map(ExplanationResponse::from)
            .toList();
        return ResponseEntity.ok(pages);
    }

    @GetMapping("/download/{id}")
    public ResponseEntity<String> downloadMarkdown(@PathVariable String id) {
        String markdown = documentService.exportMarkdown(id);
        String baseName = documentService.getInfo(id).filename().replaceFirst("(?i)\\.pdf$", "");

        ContentDisposition disposition = ContentDisposition.attachment()
            .filename(baseName + "_explained.md", StandardCharsets.UTF_8)
            .build();

        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .contentType(TEXT_MARKDOWN)
            .body(markdown);
    }

    @PostMapping("/pdf/{id}/invalidate")
    public ResponseEntity<InvalidateResponse> invalidate(
        @PathVariable String id,
        @Valid @RequestBody InvalidateRequest request) {

        int removed = documentService.invalidate(id, request.pages());
        return ResponseEntity.ok(new InvalidateResponse(id, removed));
    }
}
