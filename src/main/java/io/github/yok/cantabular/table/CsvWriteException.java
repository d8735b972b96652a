package io.github.yok.cantabular.table;

import java.io.IOException;
import lombok.Getter;

/**
 * Thrown when the CSV sink fails. The message names the phase ({@code header} or {@code row N})
 * that was being written; the original {@link IOException} is the cause.
 */
@Getter
public class CsvWriteException extends TableException {

    private static final long serialVersionUID = 1L;

    private final String phase;

    public CsvWriteException(String phase, IOException cause) {
        super("failed to write CSV " + phase + ": " + cause.getMessage(), cause);
        this.phase = phase;
    }
}
