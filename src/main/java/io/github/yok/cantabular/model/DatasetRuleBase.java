package io.github.yok.cantabular.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.yok.cantabular.model.gql.RuleBase;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The {@code dataset} field of a dimensions query response.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatasetRuleBase {

    RuleBase ruleBase;
}
