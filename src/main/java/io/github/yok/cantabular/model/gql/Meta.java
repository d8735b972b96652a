package io.github.yok.cantabular.model.gql;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * ONS metadata attached to a variable.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Meta {

    @JsonProperty("ONS_Variable")
    OnsVariable onsVariable;

    /**
     * The {@code ONS_Variable} metadata block.
     */
    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OnsVariable {

        /**
         * Position of a geography variable in the area hierarchy, as text (e.g. {@code "1"}).
         */
        @JsonProperty("Geography_Hierarchy_Order")
        String geographyHierarchyOrder;

        @JsonProperty("quality_statement_text")
        String qualityStatementText;
    }
}
