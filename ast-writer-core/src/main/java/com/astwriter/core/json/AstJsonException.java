package com.astwriter.core.json;

/**
 * Thrown when JSON input cannot be turned into a tree: malformed JSON, an unknown
 * {@code nodeType} or a missing required property.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
