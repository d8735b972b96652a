package io.github.yok.cantabular.model.gql;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Rule base variable of a dataset and the variables derived from it.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleBase {

    String name;

    /**
     * Variables the rule base variable is a source of, i.e. the dataset dimensions.
     */
    Variables isSourceOf;
}
