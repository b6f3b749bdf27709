package io.tabletalk.core.model;

public enum ExchangeStatus {
    SUCCESS,
    ERROR
}
