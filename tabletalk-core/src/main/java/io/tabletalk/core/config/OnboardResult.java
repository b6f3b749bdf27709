package io.tabletalk.core.config;

import java.nio.file.Path;

public record OnboardResult(Path configPath, WorkspaceLayout workspace, Action action) {

    public enum Action {
        CREATED,
        OVERWRITTEN,
        REFRESHED
    }
}
