package com.randomtable.engine;

/**
 * Fatal generation or parse failure. Aborts the current roll or template evaluation.
 *
 * Recoverable problems (unknown references, bad indexes) never raise this; they
 * degrade to empty text and a WARN diagnostic instead.
 */
public class TableEngineException extends RuntimeException {

    public enum ErrorType {
        RECURSION_LIMIT,
        SHARED_SHADOW,
        UNIQUE_OVERFLOW,
        PARSE_ERROR,
        TABLE_NOT_FOUND,
        TEMPLATE_NOT_FOUND,
        COLLECTION_NOT_FOUND,
        INHERITANCE_ERROR,
        INVALID_DOCUMENT
    }

    private final ErrorType type;

    public TableEngineException(ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public TableEngineException(ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ErrorType getType() {
        return type;
    }

    public static TableEngineException parse(String message) {
        return new TableEngineException(ErrorType.PARSE_ERROR, message);
    }

    public static TableEngineException recursionLimit(String sourceId, int max) {
        return new TableEngineException(ErrorType.RECURSION_LIMIT,
                "Recursion limit exceeded (" + max + ") in " + sourceId);
    }
}
