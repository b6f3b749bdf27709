package io.tabletalk.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(@JsonAlias({"session_store"}) String sessionStore) {

    public static StorageConfig defaults() {
        return new StorageConfig("sqlite");
    }
}
