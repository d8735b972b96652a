package io.github.yok.cantabular.table;

/**
 * Thrown when a {@link TableIterator} is used past the end of the table.
 */
public class TableIteratorException extends TableException {

    private static final long serialVersionUID = 1L;

    public TableIteratorException(String message) {
        super(message);
    }
}
