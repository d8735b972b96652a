package io.github.yok.cantabular.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.yok.cantabular.table.TableShapeException;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One categorical axis of a table: the variable it is built on and its ordered categories.
 *
 * <p>
 * {@code count} mirrors the optional GraphQL field of the same name. Some queries never request it,
 * so the number of categories is always taken from {@link #getCategories()}; a populated
 * {@code count} that disagrees is reported by {@link #categoryCount()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Dimension {

    /**
     * Variable metadata; its label is used as the CSV column header.
     */
    VariableBase variable;

    /**
     * Number of categories reported by the server, {@code null} when the query omits it.
     */
    Integer count;

    /**
     * Ordered categories of this dimension.
     */
    @Builder.Default
    List<Category> categories = List.of();

    /**
     * Returns the number of categories, checking it against the reported {@code count}.
     *
     * @return number of categories
     * @throws TableShapeException if {@code count} is populated and differs from the number of
     *         categories
     */
    public int categoryCount() throws TableShapeException {
        int size = categories == null ? 0 : categories.size();
        if (count != null && count != size) {
            throw new TableShapeException(String.format(
                    "dimension '%s' reports count %d but has %d categories", variableName(), count,
                    size));
        }
        return size;
    }

    /**
     * Returns the variable label, or an empty string when no variable is attached.
     *
     * @return column header for this dimension
     */
    public String headerLabel() {
        return variable == null || variable.getLabel() == null ? "" : variable.getLabel();
    }

    private String variableName() {
        return variable == null ? "" : variable.getName();
    }
}
