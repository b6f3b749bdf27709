package io.tabletalk.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheConfig(@JsonAlias({"max_datasets"}) int maxDatasets) {

    public static CacheConfig defaults() {
        return new CacheConfig(32);
    }
}
