package com.task.ccparser.service;

import java.awt.image.BufferedImage;

/**
 * Optical character recognition over a rendered page image.
 */
public interface OcrTool {

    /**
     * @param image      page rasterized at the OCR resolution
     * @param pageNumber 1-based page index, used for logging and remote payload naming
     * @return recognized text, possibly empty
     */
    String recognize(BufferedImage image, int pageNumber) throws Exception;
}
