package com.smartexpense.categorizer.model;

public record WordCount(String word, String category, long count) {
}
