package io.github.yok.cantabular.model;

import io.github.yok.cantabular.table.CancellationToken;
import io.github.yok.cantabular.table.TableIterator;
import io.github.yok.cantabular.table.TableShapeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Validated, immutable sequence of dimensions describing the structure of a table.
 *
 * <p>
 * The category count of each dimension is resolved once, on construction, so that iteration does
 * not need to re-check the upstream {@code count} field.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Dimensions {

    private final List<Dimension> dims;
    private final int[] counts;

    private Dimensions(List<Dimension> dims, int[] counts) {
        this.dims = dims;
        this.counts = counts;
    }

    /**
     * Builds a validated {@code Dimensions} from the given list.
     *
     * @param dimensions dimensions in table order; {@code null} is treated as empty
     * @return validated dimensions
     * @throws TableShapeException if a dimension's reported count disagrees with its categories
     */
    public static Dimensions of(List<Dimension> dimensions) throws TableShapeException {
        List<Dimension> copy = dimensions == null ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(dimensions));
        int[] counts = new int[copy.size()];
        for (int i = 0; i < counts.length; i++) {
            Dimension dim = copy.get(i);
            if (dim == null) {
                throw new TableShapeException("dimension " + i + " is null");
            }
            counts[i] = dim.categoryCount();
        }
        return new Dimensions(copy, counts);
    }

    public int size() {
        return dims.size();
    }

    public boolean isEmpty() {
        return dims.isEmpty();
    }

    public Dimension get(int i) {
        return dims.get(i);
    }

    /**
     * Number of categories of dimension {@code i}.
     *
     * @param i dimension index
     * @return category count
     */
    public int count(int i) {
        return counts[i];
    }

    public List<Dimension> asList() {
        return dims;
    }

    /**
     * Returns the number of cells in a table with these dimensions (the product of the category
     * counts).
     *
     * @return number of cells; {@code 0} when there are no dimensions
     * @throws TableShapeException if the product does not fit in a {@code long}
     */
    public long cellCount() throws TableShapeException {
        if (counts.length == 0) {
            return 0;
        }
        long product = 1;
        try {
            for (int c : counts) {
                product = Math.multiplyExact(product, c);
            }
        } catch (ArithmeticException e) {
            throw new TableShapeException("table cell count overflows", e);
        }
        return product;
    }

    /**
     * Returns the header row: the variable label of every dimension in order.
     *
     * @return dimension labels
     */
    public List<String> headerLabels() {
        List<String> labels = new ArrayList<>(dims.size());
        for (Dimension dim : dims) {
            labels.add(dim.headerLabel());
        }
        return labels;
    }

    /**
     * Creates an iterator positioned at the first cell, without cancellation.
     *
     * @return new iterator
     * @throws TableShapeException if there are no dimensions
     */
    public TableIterator newIterator() throws TableShapeException {
        return newIterator(CancellationToken.NONE);
    }

    /**
     * Creates an iterator positioned at the first cell that polls {@code token} on every step.
     *
     * @param token cancellation token checked at the start of each {@code next()}
     * @return new iterator
     * @throws TableShapeException if there are no dimensions
     */
    public TableIterator newIterator(CancellationToken token) throws TableShapeException {
        return new TableIterator(this, token);
    }

    @Override
    public String toString() {
        return "Dimensions" + headerLabels();
    }
}
