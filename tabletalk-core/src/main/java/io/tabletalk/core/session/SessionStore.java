package io.tabletalk.core.session;

import io.tabletalk.core.model.Exchange;
import io.tabletalk.core.model.ExchangeOutcome;
import io.tabletalk.core.model.Session;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface SessionStore {
    Session create(String datasetId, String title) throws IOException;

    Optional<Session> find(String sessionId) throws IOException;

    List<Session> list() throws IOException;

    // Assigns id, sequence and createdAt under the store's write lock; throws UnknownSessionException.
    Exchange append(String sessionId, ExchangeOutcome outcome) throws IOException;

    // Oldest first, empty for an unknown session.
    List<Exchange> history(String sessionId) throws IOException;
}
