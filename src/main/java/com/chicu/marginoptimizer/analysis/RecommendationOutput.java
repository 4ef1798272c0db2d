package com.chicu.marginoptimizer.analysis;

import java.nio.file.Path;
import java.util.List;

/**
 * Что записали локально и что ушло в удалённое хранилище (пусто, если оно выключено).
 */
public record RecommendationOutput(Path csvFile, Path jsonFile, List<String> uploadedKeys) {

    public RecommendationOutput {
        uploadedKeys = uploadedKeys == null ? List.of() : List.copyOf(uploadedKeys);
    }
}
