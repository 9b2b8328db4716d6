package com.smartexpense.categorizer.model;

public record CategoryTotal(String category, long totalWords, long docCount) {
}
