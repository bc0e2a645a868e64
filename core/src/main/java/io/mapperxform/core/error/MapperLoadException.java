package io.mapperxform.core.error;

/**
 * Abstract parent for load-time document errors. Thrown by {@code MapSpecParser}. Carries an
 * additional {@code source} field identifying the file or resource that caused the error.
 */
public abstract class MapperLoadException extends MapperException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected MapperLoadException(String message, String documentId, String source) {
        super(message, documentId);
        this.source = source;
    }

    protected MapperLoadException(String message, Throwable cause, String documentId, String source) {
        super(message, cause, documentId);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
