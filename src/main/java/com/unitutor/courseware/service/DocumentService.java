package com.unitutor.courseware.service;

import com.unitutor.courseware.model.DocumentInfo;
import com.unitutor.courseware.model.PageArtifact;
import com.unitutor.courseware.model.PageArtifactView;
import com.unitutor.courseware.model.ProcessingProgress;
import com.unitutor.courseware.model.SubmitResult;

import java.util.List;

public interface DocumentService {
    SubmitResult submitDocument(byte[] content, String filename);
    DocumentInfo getInfo(String documentId);
    ProcessingProgress getProgress(String documentId);
    PageArtifactView getArtifact(String documentId, int pageNumber);
    List<PageArtifact> exportAll(String documentId);
    String exportMarkdown(String documentId);
    int invalidate(String documentId, List<Integer> pageNumbers);
}
