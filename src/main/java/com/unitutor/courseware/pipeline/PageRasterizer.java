package com.unitutor.courseware.pipeline;

import java.nio.file.Path;

public interface PageRasterizer {

    /**
     * Renders one 1-indexed page as a PNG image.
     *
     * @throws com.unitutor.courseware.exception.PageOutOfRangeException if the page does not exist
     * @throws com.unitutor.courseware.exception.RenderException if the document cannot be rendered
     */
    byte[] render(Path documentLocation, int pageNumber);
}
