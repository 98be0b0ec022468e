package com.unitutor.courseware.infra;

import com.unitutor.courseware.exception.InvalidDocumentException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Slf4j
@Component
public class PdfBoxDocumentInspector implements DocumentInspector {

    @Override
    public int countPages(byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            int pages = document.getNumberOfPages();
            if (pages == 0) {
                throw new InvalidDocumentException("PDF has no pages");
            }
            return pages;
        } catch (IOException e) {
            log.warn("Rejected unreadable PDF: {}", e.getMessage());
            throw new InvalidDocumentException("File is not a readable PDF", e);
        }
    }
}
