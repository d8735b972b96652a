package io.github.yok.cantabular.error;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An entry of the {@code errors} array of a GraphQL response.
 *
 * <p>
 * Cantabular prefixes the message with an HTTP status, e.g.
 * {@code "404 Not Found: dataset not loaded in this server"}; {@link #statusCode()} extracts it.
 * </p>
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphQlError {

    static final int BAD_GATEWAY = 502;

    private static final Set<Integer> KNOWN_STATUS_CODES = Set.of(100, 101, 102, 103, 200, 201,
            202, 203, 204, 205, 206, 207, 208, 226, 300, 301, 302, 303, 304, 305, 307, 308, 400,
            401, 402, 403, 404, 405, 406, 407, 408, 409, 410, 411, 412, 413, 414, 415, 416, 417,
            418, 421, 422, 423, 424, 425, 426, 428, 429, 431, 451, 500, 501, 502, 503, 504, 505,
            506, 507, 508, 510, 511);

    String message;

    @Builder.Default
    List<Location> locations = List.of();

    @Builder.Default
    List<Object> path = List.of();

    /**
     * Returns the status code at the start of the message, or 502 (bad gateway) when the message
     * does not start with a known HTTP status.
     *
     * @return HTTP status code
     */
    public int statusCode() {
        if (message == null || message.length() < 3) {
            return BAD_GATEWAY;
        }
        int code;
        try {
            code = Integer.parseInt(message.substring(0, 3));
        } catch (NumberFormatException e) {
            return BAD_GATEWAY;
        }
        return KNOWN_STATUS_CODES.contains(code) ? code : BAD_GATEWAY;
    }

    /**
     * Position in the query the error refers to.
     */
    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {

        int line;

        int column;
    }
}
