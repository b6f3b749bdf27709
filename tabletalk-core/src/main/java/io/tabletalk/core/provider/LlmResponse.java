package io.tabletalk.core.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record LlmResponse(String content, Map<String, Object> usage) {
    public LlmResponse {
        content = content == null ? "" : content;
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }
}
