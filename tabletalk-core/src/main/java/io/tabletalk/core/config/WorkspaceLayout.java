package io.tabletalk.core.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public record WorkspaceLayout(Path root) {

    public static WorkspaceLayout of(Path root) {
        return new WorkspaceLayout(root);
    }

    public Path datasetFiles() {
        return root.resolve("datasets/files");
    }

    public Path datasetIndex() {
        return root.resolve("datasets/datasets.json");
    }

    public Path sessionsDatabase() {
        return root.resolve(".tabletalk/sessions.db");
    }

    public Path sessionsDirectory() {
        return root.resolve("sessions");
    }

    public Path auditLog() {
        return root.resolve(".tabletalk/observability/audit-events.jsonl");
    }

    public void ensureDirectories() throws IOException {
        Files.createDirectories(root);
        Files.createDirectories(datasetFiles());
        Files.createDirectories(sessionsDirectory());
        Files.createDirectories(sessionsDatabase().getParent());
        Files.createDirectories(auditLog().getParent());
    }
}
