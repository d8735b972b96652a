package io.github.yok.cantabular.table;

/**
 * Thrown when a table or a response is malformed: dimension counts that disagree with their
 * categories, a number of values that does not match the dimensions, or a table error reported by
 * the server.
 */
public class TableShapeException extends TableException {

    private static final long serialVersionUID = 1L;

    public TableShapeException(String message) {
        super(message);
    }

    public TableShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
