package io.tabletalk.core.model;

public enum DatasetStatus {
    PENDING,
    PROCESSING,
    READY,
    ERROR
}
