package io.github.yok.cantabular.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code cantabular} section in {@code application.yml}.
 *
 * <pre>
 * cantabular:
 *   host: http://localhost:8491
 *   ext-api-host: http://localhost:8492
 *   graphql-timeout: 60s
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "cantabular")
@Data
public class CantabularConfig {

    /**
     * Base URL of the Cantabular server (used for the {@code /v10/datasets} health check).
     */
    private String host;

    /**
     * Base URL of the Cantabular extended API that serves {@code /graphql}.
     */
    private String extApiHost;

    /**
     * Timeout applied to every HTTP request.
     */
    private Duration graphqlTimeout = Duration.ofSeconds(60);
}
