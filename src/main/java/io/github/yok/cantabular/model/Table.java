package io.github.yok.cantabular.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.yok.cantabular.table.TableShapeException;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;

/**
 * The {@code table} field of a Cantabular static dataset query.
 *
 * <p>
 * {@code values} holds one observation count per cell in row-major order: the last dimension varies
 * fastest and the first dimension slowest.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Table {

    @Builder.Default
    List<Dimension> dimensions = List.of();

    @Builder.Default
    List<Integer> values = List.of();

    /**
     * Error code reported by Cantabular in place of the table (e.g. {@code withinMaxCells}).
     */
    String error;

    public boolean hasError() {
        return StringUtils.isNotBlank(error);
    }

    /**
     * Validates the dimensions and checks that the number of values equals the product of the
     * category counts.
     *
     * @return the validated dimensions
     * @throws TableShapeException on a dimension count mismatch or a table shape mismatch
     */
    public Dimensions validateShape() throws TableShapeException {
        Dimensions dims = Dimensions.of(dimensions);
        if (dims.isEmpty()) {
            throw new TableShapeException("table shape mismatch: table has no dimensions");
        }
        long expected = dims.cellCount();
        int actual = values == null ? 0 : values.size();
        if (expected != actual) {
            throw new TableShapeException(String.format(
                    "table shape mismatch: expected %d values for dimensions %s but got %d",
                    expected, dims.headerLabels(), actual));
        }
        return dims;
    }
}
