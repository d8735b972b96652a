package io.github.yok.cantabular.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.yok.cantabular.error.GraphQlError;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Envelope of a GraphQL response: the {@code data} field and the optional {@code errors} array.
 *
 * @param <T> type of {@code data}
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphQlResponse<T> {

    private T data;

    private List<GraphQlError> errors = new ArrayList<>();

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
