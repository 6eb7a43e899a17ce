package com.example.repoassist;

/** Fatal ingestion problem, such as a root that is not a readable directory. */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
