package io.tabletalk.core.query;

public enum QueryState {
    RECEIVED,
    RESOLVING_DATASET,
    RESOLVING_CONTEXT,
    INVOKING,
    CLASSIFYING,
    PERSISTED_SUCCESS,
    PERSISTED_ERROR
}
