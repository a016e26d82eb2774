package com.task.ccparser.service;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Runs Tesseract in-process through Tess4J. A fresh engine is created per page because
 * {@link Tesseract} instances are not thread safe.
 */
@Service
@ConditionalOnProperty(name = "ocr.engine", havingValue = "tesseract", matchIfMissing = true)
public class TesseractOcrTool implements OcrTool {

    private static final Logger LOGGER = LoggerFactory.getLogger(TesseractOcrTool.class);

    private final String datapath;
    private final String language;

    public TesseractOcrTool(
            @Value("${ocr.tesseract.datapath:}") String datapath,
            @Value("${ocr.tesseract.language:eng}") String language
    ) {
        this.datapath = datapath;
        this.language = language;
    }

    @Override
    public String recognize(BufferedImage image, int pageNumber) throws TesseractException {
        String text;
        try {
            ITesseract tesseract = new Tesseract();
            if (datapath != null && !datapath.isBlank()) {
                tesseract.setDatapath(datapath);
            }
            tesseract.setLanguage(language);
            text = tesseract.doOCR(image);
        } catch (LinkageError err) {
            throw new TesseractException("Tesseract native library unavailable: " + err.getMessage(), err);
        }

        LOGGER.debug("Tesseract recognized {} characters on page {}", text == null ? 0 : text.length(), pageNumber);
        return text == null ? "" : text;
    }
}
