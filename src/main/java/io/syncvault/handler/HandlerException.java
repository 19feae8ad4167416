package io.syncvault.handler;

/**
 * Transport or storage failure raised by a {@link CollectionHandler}.
 */
public class HandlerException extends RuntimeException {
    private final String handler;

    public HandlerException(String handler, String message) {
        super(message);
        this.handler = handler;
    }

    public HandlerException(String handler, String message, Throwable cause) {
        super(message, cause);
        this.handler = handler;
    }

    public String handler() {
        return handler;
    }
}
