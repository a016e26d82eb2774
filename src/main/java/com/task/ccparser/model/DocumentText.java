package com.task.ccparser.model;

import java.util.List;
import java.util.stream.Collectors;

public record DocumentText(List<PageText> pages) {

    public DocumentText {
        pages = List.copyOf(pages);
    }

    public String fullText() {
        return pages.stream().map(PageText::resolvedText).collect(Collectors.joining("\n"));
    }

    public long ocrPageCount() {
        return pages.stream().filter(p -> p.source() != PageText.Source.EMBEDDED).count();
    }

    public boolean isBlank() {
        return fullText().isBlank();
    }
}
