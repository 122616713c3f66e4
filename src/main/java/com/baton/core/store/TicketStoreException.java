package com.baton.core.store;

/**
 * Thrown when the ticket store rejects or fails a request.
 */
public class TicketStoreException extends RuntimeException {
    public TicketStoreException(String message) {
        super(message);
    }

    public TicketStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
