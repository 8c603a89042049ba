package org.caureq.caureqspeedboard.service.prefs;

public class PreferencePersistenceException extends RuntimeException {
    private final String recipientId;

    public PreferencePersistenceException(String recipientId, String message, Throwable cause) {
        super(message, cause);
        this.recipientId = recipientId;
    }

    public String recipientId() { return recipientId; }
}
