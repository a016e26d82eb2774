package com.task.ccparser.service;

import com.task.ccparser.model.ExtractedFields;
import com.task.ccparser.model.ExtractionPrompt;
import com.task.ccparser.model.StatementField;
import org.springframework.stereotype.Component;

/**
 * Builds the extraction instruction. Only the first {@value #MAX_DOCUMENT_CHARS} characters of the
 * statement reach the model.
 */
@Component
public class ExtractionPromptBuilder {

    static final int MAX_DOCUMENT_CHARS = 7000;

    public ExtractionPrompt build(String documentText) {
        String text = documentText == null ? "" : documentText;
        boolean truncated = text.length() > MAX_DOCUMENT_CHARS;
        String excerpt = truncated ? text.substring(0, MAX_DOCUMENT_CHARS) : text;

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert financial document parser.\n");
        prompt.append("Extract the following fields from this credit card statement:\n\n");
        int index = 1;
        for (StatementField field : StatementField.values()) {
            prompt.append(index++).append(". ").append(field.key())
                    .append(" (").append(field.description()).append(")\n");
        }
        prompt.append('\n');
        prompt.append("Return ONLY a valid JSON object with these exact keys. No extra text.\n");
        prompt.append("If a field is missing, use \"").append(ExtractedFields.NOT_FOUND).append("\" as its value.\n\n");
        prompt.append("Statement text:\n");
        prompt.append(excerpt).append('\n');

        return new ExtractionPrompt(prompt.toString(), truncated);
    }
}
