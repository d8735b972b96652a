package io.github.yok.cantabular.table;

import io.github.yok.cantabular.model.Dimensions;
import io.github.yok.cantabular.model.Table;
import java.io.BufferedReader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders a fully decoded {@link Table} as CSV.
 *
 * <p>
 * The first record holds the variable label of every dimension followed by {@code count}. Each
 * following record holds the category labels of one cell and its value, cells being visited in
 * row-major order.
 * </p>
 *
 * <pre>
 * City,Siblings,count
 * London,0,1
 * London,1,0
 * ...
 * </pre>
 *
 * <p>
 * A failed render leaves whatever was already written in the sink; that output is invalid and must
 * be discarded by the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableCsvRenderer {

    /**
     * Writes the table to {@code out} row by row.
     *
     * @param table table to render
     * @param out CSV sink; flushed, not closed
     * @param token cancellation token polled before each row
     * @return number of records written, header included
     * @throws TableShapeException if the table carries an error or its shape is inconsistent
     * @throws TableCanceledException if the token is cancelled before the last row
     * @throws CsvWriteException if the sink fails
     * @throws TableException on any other table failure
     */
    public long render(Table table, Writer out, CancellationToken token) throws TableException {
        Dimensions dims = checkTable(table);
        // "values": null decodes to null; a table without cells has nothing to list
        List<Integer> values = table.getValues() == null ? List.of() : table.getValues();

        CsvRowWriter writer = new CsvRowWriter(out, token);
        writer.writeHeader(dims);
        TableIterator it = dims.newIterator();
        for (int i = 0; i < values.size(); i++) {
            Integer value = values.get(i);
            if (value == null) {
                throw new TableShapeException("table value " + i + " is null");
            }
            writer.writeRow(it, value);
            it.next();
        }
        writer.flush();
        log.debug("Rendered table {} as {} CSV rows", dims, writer.rows());
        return writer.rows();
    }

    /**
     * Renders the whole table into memory and returns a reader over the CSV text.
     *
     * @param table table to render
     * @return reader positioned at the header row
     * @throws TableException if the table is malformed
     */
    public BufferedReader renderToReader(Table table) throws TableException {
        StringWriter buffer = new StringWriter();
        render(table, buffer, CancellationToken.NONE);
        return new BufferedReader(new StringReader(buffer.toString()));
    }

    private Dimensions checkTable(Table table) throws TableShapeException {
        if (table == null) {
            throw new TableShapeException("no table to render");
        }
        if (table.hasError()) {
            throw new TableShapeException("table error: " + TableErrors.describe(table.getError()));
        }
        return table.validateShape();
    }
}
