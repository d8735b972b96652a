package io.github.yok.cantabular.table;

import io.github.yok.cantabular.model.Dimensions;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

/**
 * Writes the header and the cell rows of a table to a CSV sink, counting rows and polling the
 * cancellation token before each one.
 *
 * <p>
 * The sink is flushed but never closed; it belongs to the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
final class CsvRowWriter {

    /**
     * RFC 4180 style output: comma separated, minimal quoting, {@code \n} between records.
     */
    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setQuoteMode(QuoteMode.MINIMAL)
            .setRecordSeparator("\n").get();

    static final String COUNT_HEADER = "count";

    private final CSVPrinter printer;
    private final CancellationToken token;
    private long rows;

    CsvRowWriter(Writer out, CancellationToken token) throws CsvWriteException {
        try {
            this.printer = new CSVPrinter(out, FORMAT);
        } catch (IOException e) {
            throw new CsvWriteException("header", e);
        }
        this.token = token == null ? CancellationToken.NONE : token;
    }

    /**
     * Writes the variable labels followed by {@code count}.
     */
    void writeHeader(Dimensions dims) throws TableException {
        checkCancelled();
        List<String> header = dims.headerLabels();
        header.add(COUNT_HEADER);
        try {
            printer.printRecord(header);
        } catch (IOException e) {
            throw new CsvWriteException("header", e);
        }
        rows++;
    }

    /**
     * Writes the category labels of the iterator's current cell followed by {@code value}.
     */
    void writeRow(TableIterator it, long value) throws TableException {
        checkCancelled();
        List<String> record = new ArrayList<>(it.columns() + 1);
        for (int i = 0; i < it.columns(); i++) {
            record.add(it.categoryAtColumn(i).getLabel());
        }
        record.add(Long.toString(value));
        try {
            printer.printRecord(record);
        } catch (IOException e) {
            // rows counts the header, so this is the zero-based data row index
            throw new CsvWriteException("row " + (rows - 1), e);
        }
        rows++;
    }

    void flush() throws CsvWriteException {
        try {
            printer.flush();
        } catch (IOException e) {
            throw new CsvWriteException("flush after " + rows + " rows", e);
        }
    }

    /**
     * Rows written so far, header included.
     */
    long rows() {
        return rows;
    }

    private void checkCancelled() throws TableException {
        Throwable reason = token.cause();
        if (reason == null) {
            return;
        }
        TableCanceledException canceled = new TableCanceledException(reason, rows);
        try {
            printer.flush();
        } catch (IOException e) {
            canceled.addSuppressed(e);
        }
        log.debug("CSV output canceled after {} rows", rows);
        throw canceled;
    }
}
