package io.github.yok.cantabular.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Input of a static dataset query: the dataset name and the variables to cross-tabulate.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class StaticDatasetQueryRequest {

    String dataset;

    @Builder.Default
    List<String> variables = List.of();
}
