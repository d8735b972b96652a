package io.github.yok.cantabular.core;

import io.github.yok.cantabular.client.CantabularClient;
import io.github.yok.cantabular.model.StaticDatasetQueryRequest;
import io.github.yok.cantabular.stream.StreamPipeException;
import io.github.yok.cantabular.table.CancellationToken;
import io.github.yok.cantabular.table.TableCanceledException;
import java.io.File;
import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Exports one static dataset query to a UTF-8 CSV file.
 *
 * <p>
 * The GraphQL response is streamed straight into the file, so the table is never held in memory.
 * When the export fails, the partially written file is deleted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DatasetCsvExporter {

    private final CantabularClient client;

    public DatasetCsvExporter(CantabularClient client) {
        this.client = client;
    }

    /**
     * Runs the query and writes the CSV file.
     *
     * @param dataset dataset name
     * @param variables variables in column order
     * @param csvFile destination file (created or overwritten)
     * @param token cancellation token for the whole export
     * @return number of CSV rows written, header included
     * @throws Exception on query, transformation or file I/O error
     */
    public long execute(String dataset, List<String> variables, File csvFile,
            CancellationToken token) throws Exception {
        StaticDatasetQueryRequest request =
                StaticDatasetQueryRequest.builder().dataset(dataset).variables(variables).build();
        log.info("Exporting dataset [{}] variables {} -> {}", dataset, variables, csvFile);
        try {
            long rows = client.staticDatasetQueryStreamCsv(request,
                    in -> FileUtils.copyInputStreamToFile(in, csvFile), token);
            log.info("Dataset [{}] exported: {} rows (header included)", dataset, rows);
            return rows;
        } catch (StreamPipeException e) {
            deletePartialFile(csvFile);
            TableCanceledException canceled =
                    ExceptionUtils.throwableOfType(e, TableCanceledException.class);
            if (canceled != null) {
                log.warn("Export of dataset [{}] canceled after {} rows", dataset,
                        canceled.getRowsWritten());
            }
            throw e;
        } catch (RuntimeException | InterruptedException e) {
            deletePartialFile(csvFile);
            throw e;
        }
    }

    private static void deletePartialFile(File csvFile) {
        try {
            FileUtils.forceDelete(csvFile);
        } catch (IOException e) {
            log.debug("No partial CSV to delete at {}: {}", csvFile, e.getMessage());
        }
    }
}
