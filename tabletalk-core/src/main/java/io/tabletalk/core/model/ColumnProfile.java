package io.tabletalk.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnProfile(
    String name,
    String type,
    int nullCount,
    List<String> sampleValues
) {
    public ColumnProfile {
        name = name == null ? "" : name;
        type = type == null ? "string" : type;
        nullCount = Math.max(0, nullCount);
        sampleValues = sampleValues == null ? List.of() : List.copyOf(sampleValues);
    }
}
