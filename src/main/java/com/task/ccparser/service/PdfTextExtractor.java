package com.task.ccparser.service;

import com.task.ccparser.exception.DocumentReadException;
import com.task.ccparser.model.DocumentText;
import com.task.ccparser.model.PageText;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a PDF into page-ordered text. Pages whose text layer is missing or too short are
 * rasterized and sent through OCR; a page that cannot be recognized contributes an empty string.
 */
@Service
public class PdfTextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextExtractor.class);

    /** Pages with fewer stripped characters than this are treated as image-only. */
    static final int LEGIBILITY_THRESHOLD = 40;
    static final float OCR_DPI = 300f;

    private final OcrTool ocr;

    public PdfTextExtractor(OcrTool ocr) {
        this.ocr = ocr;
    }

    public DocumentText extract(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new DocumentReadException("Error reading PDF: document is empty", null);
        }

        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            int pageCount = document.getNumberOfPages();
            LOGGER.info("Opened PDF with {} pages", pageCount);

            PDFTextStripper stripper = new PDFTextStripper();
            PDFRenderer renderer = new PDFRenderer(document);
            List<PageText> pages = new ArrayList<>(pageCount);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                pages.add(extractPage(document, stripper, renderer, pageNumber));
            }

            DocumentText text = new DocumentText(pages);
            LOGGER.info("Extracted {} characters ({} of {} pages via OCR)",
                    text.fullText().length(), text.ocrPageCount(), pageCount);
            return text;
        } catch (IOException ex) {
            LOGGER.error("PDF extraction error: {}", ex.getMessage());
            throw new DocumentReadException("Error reading PDF: " + ex.getMessage(), ex);
        }
    }

    private PageText extractPage(PDDocument document, PDFTextStripper stripper, PDFRenderer renderer,
                                 int pageNumber) {
        String embedded = embeddedText(document, stripper, pageNumber);
        if (embedded.strip().length() >= LEGIBILITY_THRESHOLD) {
            LOGGER.info("Page {}: extracted {} characters", pageNumber, embedded.length());
            return new PageText(pageNumber, embedded, embedded, PageText.Source.EMBEDDED);
        }

        LOGGER.info("Page {}: using OCR fallback", pageNumber);
        try {
            BufferedImage image = renderer.renderImageWithDPI(pageNumber - 1, OCR_DPI, ImageType.RGB);
            String recognized = ocr.recognize(image, pageNumber);
            return new PageText(pageNumber, embedded, recognized, PageText.Source.OCR);
        } catch (Exception | LinkageError ex) {
            LOGGER.warn("Page {}: OCR failed, continuing with empty text: {}", pageNumber, ex.getMessage());
            return new PageText(pageNumber, embedded, "", PageText.Source.OCR_FAILED);
        }
    }

    private String embeddedText(PDDocument document, PDFTextStripper stripper, int pageNumber) {
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        try {
            String text = stripper.getText(document);
            return text == null ? "" : text;
        } catch (IOException ex) {
            LOGGER.warn("Page {}: text layer unreadable: {}", pageNumber, ex.getMessage());
            return "";
        }
    }
}
