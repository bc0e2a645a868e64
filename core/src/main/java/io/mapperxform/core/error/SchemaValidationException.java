package io.mapperxform.core.error;

/** Thrown when an embedded source or target JSON Schema is invalid (JSON Schema 2020-12). */
public final class SchemaValidationException extends MapperLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaValidationException(String message, String documentId, String source) {
        super(message, documentId, source);
    }

    public SchemaValidationException(String message, Throwable cause, String documentId, String source) {
        super(message, cause, documentId, source);
    }
}
