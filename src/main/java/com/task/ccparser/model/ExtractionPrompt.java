package com.task.ccparser.model;

/**
 * @param text      full instruction sent to the model
 * @param truncated whether statement text beyond the excerpt limit was dropped
 */
public record ExtractionPrompt(String text, boolean truncated) {
}
