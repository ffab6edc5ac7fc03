package io.feedloom.storage;

public final class SchemaFault extends RuntimeException {
    public SchemaFault(String message) {
        super(message);
    }

    public SchemaFault(String message, Throwable cause) {
        super(message, cause);
    }
}
