package io.github.yok.cantabular.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The {@code data} field of the dataset list query.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ListDatasetsResponse {

    @Builder.Default
    List<Item> datasets = List.of();

    /**
     * One dataset loaded in the Cantabular server.
     */
    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {

        String name;

        String label;

        String description;
    }
}
