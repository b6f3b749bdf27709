package io.tabletalk.core.session;

public class UnknownSessionException extends RuntimeException {
    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super("Unknown session " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
