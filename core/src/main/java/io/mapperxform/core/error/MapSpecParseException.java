package io.mapperxform.core.error;

/** Thrown when a MapSpec document has invalid syntax or is missing required fields. */
public final class MapSpecParseException extends MapperLoadException {

    private static final long serialVersionUID = 1L;

    public MapSpecParseException(String message, String documentId, String source) {
        super(message, documentId, source);
    }

    public MapSpecParseException(String message, Throwable cause, String documentId, String source) {
        super(message, cause, documentId, source);
    }
}
