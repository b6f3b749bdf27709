package io.tabletalk.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

public record AnalysisResult(String text, JsonNode visualization) {
    public AnalysisResult {
        text = text == null ? "" : text;
        if (visualization != null && visualization.isNull()) {
            visualization = null;
        }
    }

    public static AnalysisResult text(String text) {
        return new AnalysisResult(text, null);
    }

    public Optional<JsonNode> visualizationPayload() {
        return Optional.ofNullable(visualization);
    }
}
