package io.tabletalk.core.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tabletalk.core.model.Exchange;
import io.tabletalk.core.model.ExchangeOutcome;
import io.tabletalk.core.model.Session;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class FileSessionStore implements SessionStore {
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FileSessionStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileSessionStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Session create(String datasetId, String title) throws IOException {
        Instant now = clock.instant();
        Session session = new Session(UUID.randomUUID().toString(), datasetId, title, now, now);
        write(new SessionFile(session, List.of()));
        return session;
    }

    @Override
    public synchronized Optional<Session> find(String sessionId) throws IOException {
        return read(sessionId).map(SessionFile::session);
    }

    @Override
    public synchronized List<Session> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Session> sessions = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                sessions.add(mapper.readValue(Files.readString(file), SessionFile.class).session());
            }
        }
        sessions.sort(Comparator.comparing(Session::updatedAt).reversed());
        return sessions;
    }

    @Override
    public synchronized Exchange append(String sessionId, ExchangeOutcome outcome) throws IOException {
        SessionFile current = read(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
        List<Exchange> exchanges = new ArrayList<>(current.exchanges());

        long sequence = 1L;
        Instant now = clock.instant();
        if (!exchanges.isEmpty()) {
            Exchange last = exchanges.get(exchanges.size() - 1);
            sequence = last.sequence() + 1;
            if (now.isBefore(last.createdAt())) {
                now = last.createdAt();
            }
        }
        Exchange exchange = outcome.toExchange(UUID.randomUUID().toString(), sessionId, sequence, now);
        exchanges.add(exchange);
        write(new SessionFile(current.session().touchedAt(now), exchanges));
        return exchange;
    }

    @Override
    public synchronized List<Exchange> history(String sessionId) throws IOException {
        return read(sessionId).map(SessionFile::exchanges).orElse(List.of());
    }

    private Optional<SessionFile> read(String sessionId) throws IOException {
        Path file = fileFor(sessionId);
        if (file == null || !Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(Files.readString(file), SessionFile.class));
    }

    private void write(SessionFile sessionFile) throws IOException {
        Files.createDirectories(directory);
        Path file = fileFor(sessionFile.session().id());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(sessionFile);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path fileFor(String sessionId) {
        if (sessionId == null || sessionId.isBlank() || !sessionId.matches("[A-Za-z0-9-]+")) {
            return null;
        }
        return directory.resolve(sessionId + SUFFIX);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SessionFile(Session session, List<Exchange> exchanges) {
        SessionFile {
            exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
        }
    }
}
