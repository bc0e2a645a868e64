package io.mapperxform.core.error;

/**
 * Abstract base for all mapper-xform exceptions. Never thrown directly; use the concrete
 * subclasses under {@link MapperLoadException}.
 *
 * <p>Compilation itself never throws: a graph that cannot be fully built degrades to {@code null}
 * literals instead. Exceptions only surface while reading documents.
 */
public abstract class MapperException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String documentId;

    protected MapperException(String message, String documentId) {
        super(message);
        this.documentId = documentId;
    }

    protected MapperException(String message, Throwable cause, String documentId) {
        super(message, cause);
        this.documentId = documentId;
    }

    /** The mapper name that triggered the error, or {@code null} if not yet identified. */
    public String documentId() {
        return documentId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
