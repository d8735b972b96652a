package io.github.yok.cantabular.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Name and label of the variable a dimension is built on.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariableBase {

    String name;

    String label;

    public static VariableBase of(String name, String label) {
        return new VariableBase(name, label);
    }
}
