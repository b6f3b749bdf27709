package io.tabletalk.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
