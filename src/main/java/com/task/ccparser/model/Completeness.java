package com.task.ccparser.model;

/**
 * @param extractedCount required fields holding a real value
 * @param totalRequired  size of the required-field set
 * @param successRate    percentage in [0, 100], one decimal place
 */
public record Completeness(int extractedCount, int totalRequired, double successRate) {
}
