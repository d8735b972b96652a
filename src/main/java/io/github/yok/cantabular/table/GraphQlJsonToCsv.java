package io.github.yok.cantabular.table;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.cantabular.error.ApiException;
import io.github.yok.cantabular.error.GraphQlError;
import io.github.yok.cantabular.model.Dimension;
import io.github.yok.cantabular.model.Dimensions;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Transforms a static dataset GraphQL response into CSV while it is being read.
 *
 * <p>
 * Only {@code data.dataset.table.dimensions} is decoded into objects. The {@code values} array is
 * read one number at a time and every number is written as a CSV row straight away, so memory use
 * does not grow with the size of the table. The output has the same layout as
 * {@link TableCsvRenderer}.
 * </p>
 *
 * <p>
 * Constraints on the response:
 * </p>
 * <ul>
 * <li>{@code dimensions} must come before {@code values} inside {@code table}.</li>
 * <li>The number of values must equal the product of the dimension category counts.</li>
 * <li>A non-empty top-level {@code errors} array or a non-blank {@code table.error} fails the
 * transform with an {@link ApiException}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class GraphQlJsonToCsv {

    private static final TypeReference<List<Dimension>> DIMENSION_LIST = new TypeReference<>() {};
    private static final TypeReference<List<GraphQlError>> ERROR_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public GraphQlJsonToCsv() {
        this(new ObjectMapper());
    }

    public GraphQlJsonToCsv(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Reads the GraphQL response from {@code json} and writes the CSV table to {@code out}.
     *
     * @param json GraphQL response body; not closed
     * @param out CSV sink; flushed, not closed
     * @param token cancellation token polled before each CSV row
     * @return number of CSV rows written, header included
     * @throws TableCanceledException if the token is cancelled; the exception reports the rows
     *         written before the cancellation, which were flushed to {@code out}
     * @throws TableShapeException if the table structure is inconsistent
     * @throws CsvWriteException if {@code out} fails
     * @throws TableException on any other table failure
     * @throws ApiException if the response carries errors or is not valid JSON
     */
    public long transform(InputStream json, Writer out, CancellationToken token)
            throws TableException {
        TableState state = new TableState(new CsvRowWriter(out, token));
        try (JsonParser p = mapper.createParser(json)) {
            p.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
            p.nextToken();
            readObject(p, (name, parser) -> {
                switch (name) {
                    case "data":
                        readObject(parser, (dataField, dp) -> {
                            if ("dataset".equals(dataField)) {
                                readObject(dp, (datasetField, tp) -> {
                                    if ("table".equals(datasetField)) {
                                        readTable(tp, state);
                                    } else {
                                        tp.skipChildren();
                                    }
                                });
                            } else {
                                dp.skipChildren();
                            }
                        });
                        break;
                    case "errors":
                        checkErrors(parser);
                        break;
                    default:
                        parser.skipChildren();
                }
            });
        } catch (JsonProcessingException e) {
            throw new ApiException("failed to decode GraphQL response: " + e.getOriginalMessage(),
                    e, 500, Map.of("rows_written", state.writer.rows()));
        } catch (IOException e) {
            throw new ApiException("failed to read GraphQL response: " + e.getMessage(), e, 500,
                    Map.of("rows_written", state.writer.rows()));
        }

        if (!state.tableSeen) {
            throw new TableShapeException("response does not contain a table");
        }
        state.writer.flush();
        log.debug("Transformed GraphQL response into {} CSV rows", state.writer.rows());
        return state.writer.rows();
    }

    private void readTable(JsonParser p, TableState state) throws IOException, TableException {
        state.tableSeen = p.currentToken() != JsonToken.VALUE_NULL;
        readObject(p, (name, tp) -> {
            switch (name) {
                case "dimensions":
                    state.dims = Dimensions.of(tp.readValueAs(DIMENSION_LIST));
                    break;
                case "values":
                    readValues(tp, state);
                    break;
                case "error":
                    state.error = tp.currentToken() == JsonToken.VALUE_NULL ? null : tp.getText();
                    break;
                default:
                    tp.skipChildren();
            }
        });
        if (!state.tableSeen) {
            return;
        }
        if (StringUtils.isNotBlank(state.error)) {
            throw new ApiException("GraphQL error: " + TableErrors.describe(state.error), 400,
                    Map.of("table_error", state.error));
        }
        if (!state.valuesSeen) {
            if (state.dims == null) {
                throw new TableShapeException("table has no dimensions");
            }
            // null or missing values: only a table without cells is consistent
            readValues(null, state);
        }
    }

    private void readValues(JsonParser p, TableState state) throws IOException, TableException {
        if (p != null && p.currentToken() == JsonToken.VALUE_NULL) {
            // decided once the table error field is known
            return;
        }
        if (state.dims == null) {
            throw new TableShapeException("table values received before dimensions");
        }
        state.valuesSeen = true;
        long expected = state.dims.cellCount();
        TableIterator it = state.dims.newIterator();
        long count = 0;

        state.writer.writeHeader(state.dims);
        if (p != null) {
            if (p.currentToken() != JsonToken.START_ARRAY) {
                throw new TableShapeException("table values must be an array");
            }
            JsonToken t;
            while ((t = p.nextToken()) != JsonToken.END_ARRAY) {
                if (t != JsonToken.VALUE_NUMBER_INT) {
                    throw new TableShapeException("table value " + count + " is not an integer");
                }
                if (it.end()) {
                    throw new TableShapeException(String.format(
                            "table shape mismatch: more than %d values for dimensions %s",
                            expected, state.dims.headerLabels()));
                }
                state.writer.writeRow(it, p.getLongValue());
                it.next();
                count++;
            }
        }
        if (count != expected) {
            throw new TableShapeException(String.format(
                    "table shape mismatch: expected %d values for dimensions %s but got %d",
                    expected, state.dims.headerLabels(), count));
        }
    }

    private void checkErrors(JsonParser p) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NULL) {
            return;
        }
        List<GraphQlError> errors = p.readValueAs(ERROR_LIST);
        if (errors != null && !errors.isEmpty()) {
            throw new ApiException("error(s) returned by graphQL query", errors.get(0).statusCode(),
                    Map.of("errors", errors));
        }
    }

    /**
     * Calls {@code handler} for every field of the object at the current token, with the parser
     * positioned on the field value. A {@code null} object has no fields.
     */
    private void readObject(JsonParser p, FieldHandler handler)
            throws IOException, TableException {
        JsonToken t = p.currentToken();
        if (t == JsonToken.VALUE_NULL) {
            return;
        }
        if (t != JsonToken.START_OBJECT) {
            throw new TableShapeException("expected a JSON object but found " + t + " at "
                    + p.currentLocation().offsetDescription());
        }
        while (p.nextToken() == JsonToken.FIELD_NAME) {
            String name = p.currentName();
            p.nextToken();
            handler.handle(name, p);
        }
    }

    @FunctionalInterface
    private interface FieldHandler {
        void handle(String name, JsonParser p) throws IOException, TableException;
    }

    private static final class TableState {
        private final CsvRowWriter writer;
        private Dimensions dims;
        private String error;
        private boolean tableSeen;
        private boolean valuesSeen;

        private TableState(CsvRowWriter writer) {
            this.writer = writer;
        }
    }
}
