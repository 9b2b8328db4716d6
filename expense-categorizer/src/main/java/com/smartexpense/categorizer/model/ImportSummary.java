package com.smartexpense.categorizer.model;

public record ImportSummary(String sourceFile, int rowsRead, int rowsTrained, int rowsSkipped) {
}
