package io.github.yok.cantabular.table;

/**
 * Base class of the failures raised while iterating or rendering a table.
 *
 * @author Yasuharu.Okawauchi
 */
public class TableException extends Exception {

    private static final long serialVersionUID = 1L;

    public TableException(String message) {
        super(message);
    }

    public TableException(String message, Throwable cause) {
        super(message, cause);
    }
}
