package io.github.yok.cantabular.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Common failure of the API clients: carries the HTTP status code to report and the log data
 * collected where the failure happened (URL, request, response body ...).
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * HTTP status code associated with the failure.
     */
    private final int statusCode;

    /**
     * Structured data to log along with the failure; never {@code null}.
     */
    private final transient Map<String, Object> logData;

    public ApiException(String message, int statusCode, Map<String, Object> logData) {
        this(message, null, statusCode, logData);
    }

    public ApiException(String message, Throwable cause, int statusCode,
            Map<String, Object> logData) {
        super(message, cause);
        this.statusCode = statusCode;
        this.logData = logData == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(logData));
    }

    /**
     * Returns the status code of the first {@link ApiException} in the cause chain of
     * {@code error}.
     *
     * @param error any throwable, possibly {@code null}
     * @return the embedded status code, or {@code 0} if there is none
     */
    public static int statusCodeOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ApiException) {
                return ((ApiException) t).getStatusCode();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return 0;
    }
}
