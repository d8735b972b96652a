package io.github.yok.cantabular.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.yok.cantabular.model.gql.Edge;
import io.github.yok.cantabular.model.gql.Node;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The {@code data} field of the dimensions and geography dimensions queries.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class GetDimensionsResponse {

    DatasetRuleBase dataset;

    /**
     * Returns the dimension variables of the dataset in response order.
     *
     * @return variable nodes, empty when the response carried no rule base
     */
    public List<Node> dimensions() {
        List<Node> nodes = new ArrayList<>();
        if (dataset == null || dataset.getRuleBase() == null
                || dataset.getRuleBase().getIsSourceOf() == null) {
            return nodes;
        }
        for (Edge edge : dataset.getRuleBase().getIsSourceOf().getEdges()) {
            if (edge.getNode() != null) {
                nodes.add(edge.getNode());
            }
        }
        return nodes;
    }
}
