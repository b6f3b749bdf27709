package io.tabletalk.core.dataset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

public final class LocalDatasetStorage implements DatasetStorage {
    private final Path root;

    public LocalDatasetStorage(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    @Override
    public String store(String name, byte[] bytes) throws IOException {
        Files.createDirectories(root);
        String key = safeName(name);
        Path target = resolve(key);
        Path tmp = target.resolveSibling(key + ".tmp");
        Files.write(tmp, bytes);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return key;
    }

    @Override
    public byte[] read(String key) throws IOException {
        Path path = resolve(key);
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        return Files.readAllBytes(path);
    }

    private Path resolve(String key) throws IOException {
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new IOException("Storage key escapes storage root: " + key);
        }
        return resolved;
    }

    private String safeName(String name) {
        String raw = name == null || name.isBlank() ? "dataset.json" : name.trim();
        return raw.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
