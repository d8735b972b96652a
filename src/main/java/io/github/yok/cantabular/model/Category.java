package io.github.yok.cantabular.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One value of a dimension, as returned in the {@code categories} field of a Cantabular table.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Category {

    /**
     * Machine code of the category (e.g. {@code "0"}).
     */
    String code;

    /**
     * Human readable label (e.g. {@code "London"}).
     */
    String label;

    /**
     * Shorthand factory used by callers that build tables by hand.
     *
     * @param code category code
     * @param label category label
     * @return new category
     */
    public static Category of(String code, String label) {
        return new Category(code, label);
    }
}
