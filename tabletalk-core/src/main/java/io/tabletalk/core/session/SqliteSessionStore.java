package io.tabletalk.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabletalk.core.model.Exchange;
import io.tabletalk.core.model.ExchangeOutcome;
import io.tabletalk.core.model.ExchangeStatus;
import io.tabletalk.core.model.QueryFailure;
import io.tabletalk.core.model.Session;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class SqliteSessionStore implements SessionStore {
    private final String jdbcUrl;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SqliteSessionStore(Path dbPath) throws IOException {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteSessionStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.clock = clock;
        init();
    }

    @Override
    public synchronized Session create(String datasetId, String title) throws IOException {
        Instant now = clock.instant();
        Session session = new Session(UUID.randomUUID().toString(), datasetId, title, now, now);
        String sql = """
            INSERT INTO sessions (id, dataset_id, title, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, session.id());
            statement.setString(2, session.datasetId());
            statement.setString(3, session.title());
            statement.setString(4, session.createdAt().toString());
            statement.setString(5, session.updatedAt().toString());
            statement.executeUpdate();
            return session;
        } catch (SQLException e) {
            throw new IOException("Failed to create session", e);
        }
    }

    @Override
    public Optional<Session> find(String sessionId) throws IOException {
        String sql = """
            SELECT id, dataset_id, title, created_at, updated_at
            FROM sessions
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readSession(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read session " + sessionId, e);
        }
    }

    @Override
    public List<Session> list() throws IOException {
        String sql = """
            SELECT id, dataset_id, title, created_at, updated_at
            FROM sessions
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<Session> sessions = new ArrayList<>();
            while (resultSet.next()) {
                sessions.add(readSession(resultSet));
            }
            sessions.sort(Comparator.comparing(Session::updatedAt).reversed());
            return sessions;
        } catch (SQLException e) {
            throw new IOException("Failed to list sessions", e);
        }
    }

    @Override
    public synchronized Exchange append(String sessionId, ExchangeOutcome outcome) throws IOException {
        String insert = """
            INSERT INTO exchanges (
                id, session_id, sequence, prompt, response_text, visualization_json,
                status, error_message, failure, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                if (!sessionExists(connection, sessionId)) {
                    throw new UnknownSessionException(sessionId);
                }
                LastExchange last = lastExchange(connection, sessionId);
                Instant now = clock.instant();
                if (last.createdAt() != null && now.isBefore(last.createdAt())) {
                    now = last.createdAt();
                }
                Exchange exchange = outcome.toExchange(UUID.randomUUID().toString(), sessionId, last.sequence() + 1, now);

                try (PreparedStatement statement = connection.prepareStatement(insert)) {
                    statement.setString(1, exchange.id());
                    statement.setString(2, exchange.sessionId());
                    statement.setLong(3, exchange.sequence());
                    statement.setString(4, exchange.prompt());
                    statement.setString(5, exchange.responseText());
                    if (exchange.visualization() == null) {
                        statement.setNull(6, Types.VARCHAR);
                    } else {
                        statement.setString(6, mapper.writeValueAsString(exchange.visualization()));
                    }
                    statement.setString(7, exchange.status().name());
                    statement.setString(8, exchange.errorMessage());
                    if (exchange.failure() == null) {
                        statement.setNull(9, Types.VARCHAR);
                    } else {
                        statement.setString(9, exchange.failure().name());
                    }
                    statement.setString(10, exchange.createdAt().toString());
                    statement.executeUpdate();
                }
                try (PreparedStatement touch = connection.prepareStatement("UPDATE sessions SET updated_at = ? WHERE id = ?")) {
                    touch.setString(1, now.toString());
                    touch.setString(2, sessionId);
                    touch.executeUpdate();
                }
                connection.commit();
                return exchange;
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to append exchange to session " + sessionId, e);
        }
    }

    @Override
    public List<Exchange> history(String sessionId) throws IOException {
        String sql = """
            SELECT id, session_id, sequence, prompt, response_text, visualization_json,
                   status, error_message, failure, created_at
            FROM exchanges
            WHERE session_id = ?
            ORDER BY sequence ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<Exchange> exchanges = new ArrayList<>();
                while (resultSet.next()) {
                    exchanges.add(readExchange(resultSet));
                }
                return exchanges;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read history of session " + sessionId, e);
        }
    }

    private boolean sessionExists(Connection connection, String sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT 1 FROM sessions WHERE id = ?")) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        }
    }

    private LastExchange lastExchange(Connection connection, String sessionId) throws SQLException {
        String sql = """
            SELECT sequence, created_at
            FROM exchanges
            WHERE session_id = ?
            ORDER BY sequence DESC
            LIMIT 1
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return new LastExchange(0L, null);
                }
                return new LastExchange(resultSet.getLong("sequence"), Instant.parse(resultSet.getString("created_at")));
            }
        }
    }

    private Session readSession(ResultSet resultSet) throws SQLException {
        return new Session(
            resultSet.getString("id"),
            resultSet.getString("dataset_id"),
            resultSet.getString("title"),
            Instant.parse(resultSet.getString("created_at")),
            Instant.parse(resultSet.getString("updated_at"))
        );
    }

    private Exchange readExchange(ResultSet resultSet) throws SQLException, IOException {
        String visualizationJson = resultSet.getString("visualization_json");
        JsonNode visualization = visualizationJson == null ? null : mapper.readTree(visualizationJson);
        String failure = resultSet.getString("failure");
        return new Exchange(
            resultSet.getString("id"),
            resultSet.getString("session_id"),
            resultSet.getLong("sequence"),
            resultSet.getString("prompt"),
            resultSet.getString("response_text"),
            visualization,
            ExchangeStatus.valueOf(resultSet.getString("status")),
            resultSet.getString("error_message"),
            failure == null ? null : QueryFailure.valueOf(failure),
            Instant.parse(resultSet.getString("created_at"))
        );
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        String sessions = """
            CREATE TABLE IF NOT EXISTS sessions (
                id TEXT PRIMARY KEY,
                dataset_id TEXT NOT NULL,
                title TEXT NOT NULL,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """;
        String exchanges = """
            CREATE TABLE IF NOT EXISTS exchanges (
                id TEXT PRIMARY KEY,
                session_id TEXT NOT NULL REFERENCES sessions(id),
                sequence INTEGER NOT NULL,
                prompt TEXT NOT NULL,
                response_text TEXT NOT NULL,
                visualization_json TEXT,
                status TEXT NOT NULL,
                error_message TEXT NOT NULL,
                failure TEXT,
                created_at TEXT NOT NULL,
                UNIQUE (session_id, sequence)
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(sessions);
            statement.execute(exchanges);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite session store", e);
        }
    }

    private record LastExchange(long sequence, Instant createdAt) {
    }
}
