package com.example.mongoprofile.source;

/**
 * Failure while reading documents. Aborts the current profiling run; no partial report is produced.
 */
public class DocumentSourceException extends RuntimeException {

    public DocumentSourceException(String message) {
        super(message);
    }

    public DocumentSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
