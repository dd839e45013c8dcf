package com.protogen.generator.exception;

/**
 * Base class for every failure raised while loading, parsing or resolving schemas.
 * All of them are fatal for the session that raised them.
 */
public class SchemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
