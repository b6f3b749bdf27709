package io.tabletalk.core.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileAuditStore implements AuditStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileAuditStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileAuditStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(AuditEvent event) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        Files.writeString(
            path,
            mapper.writeValueAsString(event) + "\n",
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
    }

    @Override
    public synchronized List<AuditEvent> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<AuditEvent> events = new ArrayList<>();
        int skipped = 0;
        for (String line : Files.readAllLines(path)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(mapper.readValue(line, AuditEvent.class));
            } catch (JsonProcessingException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            LOG.warn("Skipped {} unreadable line(s) in audit log {}", skipped, path);
        }
        return events;
    }

    @Override
    public synchronized void trim(int retain) throws IOException {
        List<AuditEvent> events = load();
        if (!Files.exists(path) || events.size() <= retain) {
            return;
        }
        StringBuilder kept = new StringBuilder();
        for (AuditEvent event : events.subList(events.size() - Math.max(0, retain), events.size())) {
            kept.append(mapper.writeValueAsString(event)).append('\n');
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, kept);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.debug("Trimmed audit log {} to {} events", path, retain);
    }
}
