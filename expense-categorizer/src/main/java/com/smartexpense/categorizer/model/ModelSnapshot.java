package com.smartexpense.categorizer.model;

import java.util.List;

public record ModelSnapshot(long vocabSize, long totalDocs, List<CategoryTotal> categories) {
}
