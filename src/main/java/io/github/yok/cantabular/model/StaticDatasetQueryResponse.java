package io.github.yok.cantabular.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The {@code data} field of a static dataset GraphQL response.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class StaticDatasetQueryResponse {

    StaticDataset dataset;

    /**
     * Returns the table of the dataset, or {@code null} if the response carried no dataset.
     *
     * @return the table
     */
    public Table table() {
        return dataset == null ? null : dataset.getTable();
    }
}
