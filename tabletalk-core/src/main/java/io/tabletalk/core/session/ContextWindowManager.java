package io.tabletalk.core.session;

import io.tabletalk.core.model.Exchange;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Selects the prior exchanges that are replayed to the analysis client as conversational context.
 *
 * <p>Only successful exchanges are eligible. The window holds the most recent {@code maxEntries} of
 * them in chronological order; when a token budget is given the oldest entries are dropped until the
 * estimated size fits.
 */
public final class ContextWindowManager {
    public static final int DEFAULT_MAX_ENTRIES = 10;

    private final SessionStore sessionStore;

    public ContextWindowManager(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    public List<Exchange> window(String sessionId) throws IOException {
        return window(sessionId, DEFAULT_MAX_ENTRIES, 0);
    }

    public List<Exchange> window(String sessionId, int maxEntries) throws IOException {
        return window(sessionId, maxEntries, 0);
    }

    /**
     * @param tokenBudget estimated token ceiling for the whole window, {@code <= 0} for none
     */
    public List<Exchange> window(String sessionId, int maxEntries, int tokenBudget) throws IOException {
        if (maxEntries <= 0) {
            return List.of();
        }
        List<Exchange> successful = sessionStore.history(sessionId).stream()
            .filter(Exchange::succeeded)
            .toList();
        List<Exchange> recent = successful.subList(Math.max(0, successful.size() - maxEntries), successful.size());
        if (tokenBudget <= 0) {
            return List.copyOf(recent);
        }

        List<Exchange> selected = new ArrayList<>();
        long used = 0;
        for (int i = recent.size() - 1; i >= 0; i--) {
            Exchange exchange = recent.get(i);
            long cost = estimateTokens(exchange);
            if (used + cost > tokenBudget) {
                break;
            }
            used += cost;
            selected.add(exchange);
        }
        Collections.reverse(selected);
        return List.copyOf(selected);
    }

    /**
     * Rough token count: one token per four characters of prompt and response text.
     */
    public static long estimateTokens(Exchange exchange) {
        long chars = (long) exchange.prompt().length() + exchange.responseText().length();
        return (chars + 3) / 4;
    }
}
