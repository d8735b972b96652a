package io.github.yok.cantabular.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.cantabular.config.CantabularConfig;
import io.github.yok.cantabular.error.ApiException;
import io.github.yok.cantabular.model.GetDimensionsResponse;
import io.github.yok.cantabular.model.ListDatasetsResponse;
import io.github.yok.cantabular.model.StaticDatasetQueryRequest;
import io.github.yok.cantabular.model.StaticDatasetQueryResponse;
import io.github.yok.cantabular.model.Table;
import io.github.yok.cantabular.stream.StreamPipe;
import io.github.yok.cantabular.stream.StreamPipeException;
import io.github.yok.cantabular.table.CancellationToken;
import io.github.yok.cantabular.table.GraphQlJsonToCsv;
import io.github.yok.cantabular.table.TableCsvRenderer;
import io.github.yok.cantabular.table.TableErrors;
import io.github.yok.cantabular.table.TableException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Client for the Cantabular server and its extended GraphQL API.
 *
 * <p>
 * Static dataset queries are sent as {@code POST {extApiHost}/graphql}. Responses are either
 * decoded whole ({@link #staticDatasetQuery}, {@link #getDimensionOptions}) or transformed to CSV
 * while they are read ({@link #staticDatasetQueryStreamCsv}); use the streaming variant for large
 * tables.
 * </p>
 *
 * <p>
 * Every failure is reported as an {@link ApiException} carrying the HTTP status to surface and the
 * log data collected on the way. Nothing is retried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CantabularClient {

    public static final String SERVICE = "cantabular";
    public static final String SERVICE_API_EXT = "cantabularAPIExt";
    public static final String SOFTWARE_VERSION = "v10";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String host;
    private final String extApiHost;
    private final Duration timeout;
    private final TableCsvRenderer renderer = new TableCsvRenderer();
    private final GraphQlJsonToCsv jsonToCsv;

    /**
     * Creates a client with its own {@link HttpClient}.
     *
     * @param config Cantabular configuration
     */
    public CantabularClient(CantabularConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.getGraphqlTimeout()).build(),
                new ObjectMapper());
    }

    /**
     * Creates a client on top of the given HTTP client and object mapper.
     *
     * @param config Cantabular configuration
     * @param httpClient HTTP client used for every request
     * @param mapper JSON mapper
     */
    public CantabularClient(CantabularConfig config, HttpClient httpClient, ObjectMapper mapper) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.host = StringUtils.removeEnd(config.getHost(), "/");
        this.extApiHost = StringUtils.removeEnd(config.getExtApiHost(), "/");
        this.timeout = config.getGraphqlTimeout();
        this.jsonToCsv = new GraphQlJsonToCsv(mapper);
    }

    /**
     * Queries a static dataset and decodes the whole response in memory. Use only when the table
     * is known to be small.
     *
     * @param request dataset and variables
     * @return decoded response
     * @throws ApiException on transport, HTTP, GraphQL or table errors
     */
    public StaticDatasetQueryResponse staticDatasetQuery(StaticDatasetQueryRequest request) {
        return queryTable(GraphQlQueries.STATIC_DATASET, request);
    }

    /**
     * Queries the dimension options (variables and categories) of a static dataset. The dimension
     * {@code count} is not requested; category counts come from the categories themselves.
     *
     * @param request dataset and variables
     * @return decoded response
     * @throws ApiException on transport, HTTP, GraphQL or table errors
     */
    public StaticDatasetQueryResponse getDimensionOptions(StaticDatasetQueryRequest request) {
        return queryTable(GraphQlQueries.DIMENSION_OPTIONS, request);
    }

    /**
     * Lists the datasets loaded in the Cantabular server.
     *
     * @return dataset names, labels and descriptions
     * @throws ApiException on transport, HTTP or GraphQL errors
     */
    public ListDatasetsResponse listDatasets() {
        return query(GraphQlQueries.LIST_DATASETS, new LinkedHashMap<>(),
                ListDatasetsResponse.class);
    }

    /**
     * Queries all the dimensions of a dataset. The whole response is loaded in memory.
     *
     * @param dataset dataset name
     * @return rule base variable and the dimensions derived from it
     * @throws ApiException on transport, HTTP or GraphQL errors
     */
    public GetDimensionsResponse getDimensions(String dataset) {
        return query(GraphQlQueries.DIMENSIONS, datasetVariables(dataset),
                GetDimensionsResponse.class);
    }

    /**
     * Queries the geography dimensions of a dataset, with their hierarchy order.
     *
     * @param dataset dataset name
     * @return rule base variable and the geography dimensions
     * @throws ApiException on transport, HTTP or GraphQL errors
     */
    public GetDimensionsResponse getGeographyDimensions(String dataset) {
        return query(GraphQlQueries.GEOGRAPHY_DIMENSIONS, datasetVariables(dataset),
                GetDimensionsResponse.class);
    }

    /**
     * Queries a static dataset and streams the response to {@code consumer} as CSV, without
     * holding the table in memory.
     *
     * @param request dataset and variables
     * @param consumer reads the CSV stream on its own thread
     * @param token cancellation token polled before each CSV row
     * @return number of CSV rows written, header included
     * @throws ApiException if the query itself fails
     * @throws StreamPipeException if the transformation or the consumer fails; a
     *         {@link io.github.yok.cantabular.table.TableCanceledException} cause reports the rows
     *         written before cancellation
     * @throws InterruptedException if interrupted while waiting for the stream to finish
     */
    public long staticDatasetQueryStreamCsv(StaticDatasetQueryRequest request,
            StreamPipe.Consumer consumer, CancellationToken token)
            throws StreamPipeException, InterruptedException {
        HttpResponse<InputStream> response =
                postGraphQl(GraphQlQueries.STATIC_DATASET, tableVariables(request));
        AtomicLong rows = new AtomicLong();
        StreamPipe.stream(response.body(), (in, out) -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            rows.set(jsonToCsv.transform(in, writer, token));
            writer.flush();
        }, consumer);
        log.debug("Streamed dataset '{}' as {} CSV rows", request.getDataset(), rows.get());
        return rows.get();
    }

    /**
     * Renders an already decoded table to CSV in memory.
     *
     * @param table decoded table
     * @return reader over the CSV text
     * @throws TableException if the table is malformed
     */
    public BufferedReader parseTable(Table table) throws TableException {
        return renderer.renderToReader(table);
    }

    /**
     * Checks the Cantabular server through {@code GET {host}/v10/datasets}.
     *
     * @return health state
     */
    public HealthCheckState checker() {
        return checkHealth(SERVICE, host + "/" + SOFTWARE_VERSION + "/datasets");
    }

    /**
     * Checks the extended API through a minimal GraphQL query.
     *
     * @return health state
     */
    public HealthCheckState checkerApiExt() {
        return checkHealth(SERVICE_API_EXT, extApiHost + "/graphql?query="
                + URLEncoder.encode(GraphQlQueries.HEALTH, StandardCharsets.UTF_8));
    }

    /**
     * Returns the HTTP status embedded in {@code error}, or {@code 0}.
     *
     * @param error failure returned by this client
     * @return status code
     */
    public int statusCode(Throwable error) {
        return ApiException.statusCodeOf(error);
    }

    private StaticDatasetQueryResponse queryTable(String query,
            StaticDatasetQueryRequest request) {
        Map<String, Object> variables = tableVariables(request);
        StaticDatasetQueryResponse data = query(query, variables, StaticDatasetQueryResponse.class);
        if (data != null && data.table() != null && data.table().hasError()) {
            throw new ApiException(
                    "GraphQL error: " + TableErrors.describe(data.table().getError()), 400,
                    logData(graphQlUrl(), variables));
        }
        return data;
    }

    /**
     * Posts the query, decodes the whole response and fails on GraphQL errors.
     */
    private <T> T query(String query, Map<String, Object> variables, Class<T> dataType) {
        JavaType type =
                mapper.getTypeFactory().constructParametricType(GraphQlResponse.class, dataType);
        GraphQlResponse<T> resp = queryUnmarshal(query, variables, type);
        if (resp.hasErrors()) {
            throw new ApiException("error(s) returned by graphQL query",
                    resp.getErrors().get(0).statusCode(), Map.of("errors", resp.getErrors()));
        }
        return resp.getData();
    }

    private <T> T queryUnmarshal(String query, Map<String, Object> variables, JavaType type) {
        String url = graphQlUrl();
        HttpResponse<InputStream> response = postGraphQl(query, variables);
        byte[] body;
        try (InputStream in = response.body()) {
            body = in.readAllBytes();
        } catch (IOException e) {
            throw new ApiException("failed to read response body: " + e.getMessage(), e,
                    response.statusCode(), Map.of("url", url));
        }
        try {
            return mapper.readValue(body, type);
        } catch (IOException e) {
            throw new ApiException("failed to unmarshal response body: " + e.getMessage(), e, 500,
                    Map.of("url", url, "response_body", new String(body, StandardCharsets.UTF_8)));
        }
    }

    /**
     * Posts the query and returns the open response; the caller closes the body.
     */
    private HttpResponse<InputStream> postGraphQl(String query, Map<String, Object> variables) {
        if (StringUtils.isBlank(extApiHost)) {
            throw new ApiException("cantabular Extended API Client not configured", 503, null);
        }
        String url = graphQlUrl();
        Map<String, Object> logData = logData(url, variables);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("variables", variables);
        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ApiException("failed to encode GraphQL query: " + e.getOriginalMessage(), e,
                    500, logData);
        }

        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body)).build();
        } catch (IllegalArgumentException e) {
            throw new ApiException("invalid GraphQL URL: " + e.getMessage(), e, 500, logData);
        }
        log.debug("POST {} variables={}", url, variables);
        HttpResponse<InputStream> response = send(httpRequest, logData);
        if (response.statusCode() != 200) {
            throw errorResponse(url, response);
        }
        return response;
    }

    private HttpResponse<InputStream> send(HttpRequest request, Map<String, Object> logData) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new ApiException("failed to make GraphQL query: " + e.getMessage(), e, 500,
                    logData);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException("interrupted while making GraphQL query", e, 500, logData);
        }
    }

    /**
     * Builds the exception for a non-200 response from the {@code message} field of its body.
     */
    private ApiException errorResponse(String url, HttpResponse<InputStream> response) {
        byte[] bytes;
        try (InputStream in = response.body()) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            return new ApiException("failed to read error response body: " + e.getMessage(), e,
                    response.statusCode(), Map.of("url", url));
        }
        String body = bytes.length == 0 ? "[response body empty]"
                : new String(bytes, StandardCharsets.UTF_8);
        try {
            JsonNode node = mapper.readTree(body);
            String message = node.path("message").asText("");
            return new ApiException(message, response.statusCode(), Map.of("url", url));
        } catch (JsonProcessingException e) {
            return new ApiException(
                    "failed to unmarshal error response body: " + e.getOriginalMessage(), e,
                    response.statusCode(), Map.of("url", url, "response_body", body));
        }
    }

    private HealthCheckState checkHealth(String service, String url) {
        int code;
        try {
            HttpRequest request =
                    HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout).GET().build();
            HttpResponse<Void> response =
                    httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            code = response.statusCode();
        } catch (IllegalArgumentException e) {
            log.error("invalid health check URL: service={}, url={}", service, url, e);
            return HealthCheckState.unreachable(service, e.getMessage());
        } catch (IOException e) {
            log.error("failed to request service health: service={}", service, e);
            return HealthCheckState.unreachable(service, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("interrupted while requesting service health: service={}", service, e);
            return HealthCheckState.unreachable(service, "interrupted");
        }
        return code == 200 ? HealthCheckState.ok(service, code)
                : HealthCheckState.critical(service, code);
    }

    private String graphQlUrl() {
        return extApiHost + "/graphql";
    }

    private static Map<String, Object> tableVariables(StaticDatasetQueryRequest request) {
        Map<String, Object> variables = datasetVariables(request.getDataset());
        variables.put("variables", request.getVariables());
        return variables;
    }

    private static Map<String, Object> datasetVariables(String dataset) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("dataset", dataset);
        return variables;
    }

    private static Map<String, Object> logData(String url, Map<String, Object> variables) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("url", url);
        data.put("variables", variables);
        return data;
    }
}
