package com.task.ccparser.model;

/**
 * Text resolved for a single PDF page.
 *
 * @param pageNumber   1-based page index
 * @param embeddedText text layer as extracted by PDFBox, empty when absent
 * @param resolvedText text used downstream, never null
 * @param source       where {@code resolvedText} came from
 */
public record PageText(int pageNumber, String embeddedText, String resolvedText, Source source) {

    public enum Source {
        EMBEDDED,
        OCR,
        OCR_FAILED
    }

    public PageText {
        embeddedText = embeddedText == null ? "" : embeddedText;
        resolvedText = resolvedText == null ? "" : resolvedText;
    }
}
