package io.github.yok.cantabular.table;

import java.util.Map;

/**
 * Maps the error codes Cantabular returns in {@code table.error} to readable messages.
 */
public final class TableErrors {

    private static final Map<String, String> MESSAGES =
            Map.of("withinMaxCells", "resulting dataset too large");

    private TableErrors() {
        // Utility class; do not instantiate.
    }

    /**
     * Returns the readable message for a table error code, or the code itself when unknown.
     *
     * @param code error code from the response
     * @return message to report
     */
    public static String describe(String code) {
        return MESSAGES.getOrDefault(code, code);
    }
}
