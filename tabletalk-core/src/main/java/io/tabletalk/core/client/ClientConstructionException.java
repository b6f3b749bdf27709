package io.tabletalk.core.client;

public class ClientConstructionException extends RuntimeException {

    public ClientConstructionException(String message) {
        super(message);
    }

    public ClientConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
