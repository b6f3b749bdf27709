package io.tabletalk.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TabletalkConfig(
    String workspace,
    ProviderConfig provider,
    QueryConfig query,
    CacheConfig cache,
    StorageConfig storage
) {

    public static TabletalkConfig defaults() {
        return new TabletalkConfig(
            "~/.tabletalk/workspace",
            ProviderConfig.defaults(),
            QueryConfig.defaults(),
            CacheConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}
