package io.github.yok.cantabular.model.gql;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A variable as returned inside a {@link Variables} connection. Which fields are populated depends
 * on the query.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Node {

    String name;

    String label;

    String description;

    /**
     * Set on source variables that may only be used for filtering.
     */
    boolean filterOnly;

    Categories categories;

    /**
     * Variables this one is mapped from, nearest first.
     */
    @Builder.Default
    List<Variables> mapFrom = List.of();

    Meta meta;

    /**
     * Returns the number of categories, {@code 0} when it was not requested.
     *
     * @return category count
     */
    public int categoryCount() {
        return categories == null ? 0 : categories.getTotalCount();
    }
}
