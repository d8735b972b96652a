package io.github.yok.cantabular.table;

import io.github.yok.cantabular.model.Category;
import io.github.yok.cantabular.model.Dimensions;
import java.util.Arrays;

/**
 * Walks the coordinates of every cell of a table in row-major order.
 *
 * <p>
 * The iterator keeps one index per dimension and advances them like a mixed-radix counter whose
 * least significant digit is the last dimension. Nothing is materialised beyond the index array.
 * An iterator is not thread-safe and is meant to be owned by a single caller.
 * </p>
 *
 * <pre>
 * TableIterator it = dims.newIterator(token);
 * while (!it.end()) {
 *     Category first = it.categoryAtColumn(0);
 *     ...
 *     it.next();
 * }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TableIterator {

    private final Dimensions dims;
    private final CancellationToken token;
    private final int[] dimIndices;
    private final boolean empty;

    /**
     * Creates an iterator at the first cell.
     *
     * @param dims validated dimensions
     * @param token cancellation token polled by {@link #next()}
     * @throws TableShapeException if {@code dims} has no dimension
     */
    public TableIterator(Dimensions dims, CancellationToken token) throws TableShapeException {
        if (dims.isEmpty()) {
            throw new TableShapeException("cannot iterate a table without dimensions");
        }
        this.dims = dims;
        this.token = token == null ? CancellationToken.NONE : token;
        this.dimIndices = new int[dims.size()];
        boolean anyEmpty = false;
        for (int i = 0; i < dims.size(); i++) {
            anyEmpty |= dims.count(i) == 0;
        }
        this.empty = anyEmpty;
    }

    /**
     * Returns {@code true} once every cell has been visited. A table with a dimension without
     * categories has no cells and is at the end from the start.
     *
     * @return whether the iterator is past the last cell
     */
    public boolean end() {
        return empty || dimIndices[0] >= dims.count(0);
    }

    /**
     * Advances to the next cell.
     *
     * @throws TableCanceledException if the cancellation token is cancelled; checked before any
     *         index is touched
     * @throws TableIteratorException if the iterator is already at the end
     */
    public void next() throws TableCanceledException, TableIteratorException {
        token.throwIfCancelled(0);
        checkNotAtEnd();
        for (int j = dimIndices.length - 1; j >= 0; j--) {
            dimIndices[j]++;
            // the first index is allowed to reach its count, which marks the end
            if (dimIndices[j] < dims.count(j) || j == 0) {
                break;
            }
            dimIndices[j] = 0;
        }
    }

    /**
     * Returns the category of dimension {@code i} at the current cell.
     *
     * @param i dimension index
     * @return category of that dimension
     * @throws TableIteratorException if the iterator is at the end or {@code i} is out of range
     */
    public Category categoryAtColumn(int i) throws TableIteratorException {
        checkNotAtEnd();
        if (i < 0 || i >= dimIndices.length) {
            throw new TableIteratorException(
                    "column " + i + " out of range for " + dimIndices.length + " dimensions");
        }
        return dims.get(i).getCategories().get(dimIndices[i]);
    }

    /**
     * Returns a copy of the current per-dimension indices.
     *
     * @return current coordinates
     */
    public int[] coordinates() {
        return Arrays.copyOf(dimIndices, dimIndices.length);
    }

    public int columns() {
        return dimIndices.length;
    }

    private void checkNotAtEnd() throws TableIteratorException {
        if (end()) {
            throw new TableIteratorException("after end of table");
        }
    }
}
