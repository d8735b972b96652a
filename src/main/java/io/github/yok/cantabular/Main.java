package io.github.yok.cantabular;

import io.github.yok.cantabular.client.CantabularClient;
import io.github.yok.cantabular.client.HealthCheckState;
import io.github.yok.cantabular.config.CantabularConfig;
import io.github.yok.cantabular.config.ExportConfig;
import io.github.yok.cantabular.core.DatasetCsvExporter;
import io.github.yok.cantabular.table.CancellationToken;
import io.github.yok.cantabular.util.ErrorHandler;
import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Exports a Cantabular static dataset query to a CSV file. Defaults come from the {@code export}
 * section of {@code application.yml}; the following options override them:
 * </p>
 * <ul>
 * <li>{@code --dataset name} or {@code -d name}: dataset to query.</li>
 * <li>{@code --variables a,b,c} or {@code -v a,b,c}: variables in column order.</li>
 * <li>{@code --output file} or {@code -o file}: destination CSV file.</li>
 * <li>{@code --health}: only run the health checks and report them.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 * @see CantabularConfig
 * @see ExportConfig
 * @see DatasetCsvExporter
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({CantabularConfig.class, ExportConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final CantabularConfig cantabularConfig;
    private final ExportConfig exportConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Parses the arguments and runs the export or the health checks.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String dataset = exportConfig.getDataset();
        List<String> variables = exportConfig.getVariables();
        String output = exportConfig.getOutput();
        boolean healthOnly = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dataset":
                case "-d":
                    dataset = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--variables":
                case "-v":
                    if (i + 1 < args.length) {
                        variables = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(StringUtils::isNotEmpty).collect(Collectors.toList());
                    }
                    break;
                case "--output":
                case "-o":
                    output = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--health":
                    healthOnly = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        CantabularClient client = createClient();
        if (healthOnly) {
            reportHealth(client.checker());
            reportHealth(client.checkerApiExt());
            return;
        }

        if (StringUtils.isBlank(dataset)) {
            ErrorHandler.usageError("Dataset name is required.");
            return;
        }
        if (variables == null || variables.isEmpty()) {
            ErrorHandler.usageError("At least one variable is required.");
            return;
        }
        if (StringUtils.isBlank(output)) {
            ErrorHandler.usageError("Output file is required.");
            return;
        }

        log.info("Dataset: {}, Variables: {}, Output: {}", dataset, variables, output);
        try {
            long rows = new DatasetCsvExporter(client).execute(dataset, variables,
                    new File(output), CancellationToken.withTimeout(exportConfig.getTimeout()));
            log.info("Wrote {} rows to {}", rows, output);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ErrorHandler.exportFailed(dataset, e);
        }
    }

    CantabularClient createClient() {
        return new CantabularClient(cantabularConfig);
    }

    private static void reportHealth(HealthCheckState state) {
        if (state.getStatus() == HealthCheckState.Status.OK) {
            log.info("{} (status code {})", state.getMessage(), state.getStatusCode());
        } else {
            log.warn("{} (status code {})", state.getMessage(), state.getStatusCode());
        }
    }
}
