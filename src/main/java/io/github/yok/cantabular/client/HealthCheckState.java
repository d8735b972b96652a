package io.github.yok.cantabular.client;

import java.time.Instant;
import lombok.Value;

/**
 * Result of a health check against one upstream service.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class HealthCheckState {

    /**
     * Health status of a checked service.
     */
    public enum Status {
        OK, CRITICAL
    }

    static final String OK_MESSAGE = " is ok";
    static final String CRITICAL_MESSAGE = " functionality is unavailable or non-functioning";

    String service;

    Status status;

    /**
     * HTTP status returned by the service, {@code 0} when no response was received.
     */
    int statusCode;

    String message;

    Instant checkedAt;

    static HealthCheckState ok(String service, int statusCode) {
        return new HealthCheckState(service, Status.OK, statusCode, service + OK_MESSAGE,
                Instant.now());
    }

    static HealthCheckState critical(String service, int statusCode) {
        return new HealthCheckState(service, Status.CRITICAL, statusCode,
                service + CRITICAL_MESSAGE, Instant.now());
    }

    static HealthCheckState unreachable(String service, String reason) {
        return new HealthCheckState(service, Status.CRITICAL, 0, reason, Instant.now());
    }
}
