package io.github.yok.cantabular.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code export} section in {@code application.yml}: the
 * default dataset query written to CSV by the command line runner. Command line options override
 * these values.
 */
@ConfigurationProperties(prefix = "export")
@Data
public class ExportConfig {

    /**
     * Cantabular dataset name.
     */
    private String dataset;

    /**
     * Variables to cross-tabulate, in column order.
     */
    private List<String> variables = new ArrayList<>();

    /**
     * Destination CSV file.
     */
    private String output = "dataset.csv";

    /**
     * Time budget of the whole export; the export is canceled once it is spent.
     */
    private Duration timeout = Duration.ofMinutes(10);
}
