package com.unitutor.courseware.infra;

import com.unitutor.courseware.config.StorageProperties;
import com.unitutor.courseware.exception.PageOutOfRangeException;
import com.unitutor.courseware.exception.RenderException;
import com.unitutor.courseware.pipeline.PageRasterizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;

@Slf4j
@Component
@RequiredArgsConstructor
public class PdfBoxPageRasterizer implements PageRasterizer {

    private final StorageProperties storageProperties;

    @Override
    public byte[] render(Path documentLocation, int pageNumber) {
        try (PDDocument document = Loader.loadPDF(documentLocation.toFile())) {
            int totalPages = document.getNumberOfPages();
            if (pageNumber < 1 || pageNumber > totalPages) {
                throw new PageOutOfRangeException(pageNumber, totalPages);
            }

            PDFRenderer renderer = new PDFRenderer(document);
            BufferedImage image = renderer.renderImageWithDPI(pageNumber - 1, storageProperties.renderDpi(), ImageType.RGB);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            log.debug("Rendered page {} of {} ({} bytes)", pageNumber, documentLocation.getFileName(), out.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new RenderException("Failed to render page " + pageNumber + " of " + documentLocation, e);
        }
    }
}
