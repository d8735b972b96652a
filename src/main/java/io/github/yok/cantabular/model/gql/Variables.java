package io.github.yok.cantabular.model.gql;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * GraphQL connection of variables ({@code edges} of {@code node}s).
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Variables {

    @Builder.Default
    List<Edge> edges = List.of();

    /**
     * Number of variables in the connection; {@code 0} when not requested.
     */
    int totalCount;
}
