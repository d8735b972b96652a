package io.github.yok.cantabular;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.cantabular.client.CantabularClient;
import io.github.yok.cantabular.client.HealthCheckState;
import io.github.yok.cantabular.config.CantabularConfig;
import io.github.yok.cantabular.config.ExportConfig;
import io.github.yok.cantabular.core.DatasetCsvExporter;
import io.github.yok.cantabular.error.ApiException;
import io.github.yok.cantabular.util.ErrorHandler;
import java.io.File;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private CantabularConfig cantabularConfig;
    private ExportConfig exportConfig;
    private Main main;

    @BeforeEach
    void setup() {
        cantabularConfig = new CantabularConfig();
        cantabularConfig.setHost("http://localhost:8491");
        cantabularConfig.setExtApiHost("http://localhost:8492");

        exportConfig = new ExportConfig();
        exportConfig.setDataset("Teaching-Dataset");
        exportConfig.setVariables(List.of("city", "sex"));
        exportConfig.setOutput("target/dataset.csv");
        exportConfig.setTimeout(Duration.ofMinutes(1));

        main = new Main(cantabularConfig, exportConfig);
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    // run(String...) をスタブ
                    when(mock.run(any(String[].class))).thenReturn(null);

                    // コンストラクタ引数を検証
                    Object arg0 = ctx.arguments().get(0);
                    assertTrue(arg0 instanceof Class<?>[]);
                    Class<?>[] sources = (Class<?>[]) arg0;
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"--dataset", "Teaching-Dataset"});

            SpringApplication app = mocked.constructed().get(0);

            // addCommandLineProperties(false) が呼ばれたこと
            verify(app).setAddCommandLineProperties(false);

            verify(app).run(eq("--dataset"), eq("Teaching-Dataset"));
        }
    }

    @Test
    void run_正常ケース_引数なしは設定値でエクスポートされること() throws Exception {
        try (MockedConstruction<DatasetCsvExporter> mocked =
                mockConstruction(DatasetCsvExporter.class)) {

            main.run();

            DatasetCsvExporter exporter = mocked.constructed().get(0);
            verify(exporter).execute(eq("Teaching-Dataset"), eq(List.of("city", "sex")),
                    eq(new File("target/dataset.csv")), any());
        }
    }

    @Test
    void run_正常ケース_引数で設定値が上書きされること() throws Exception {
        try (MockedConstruction<DatasetCsvExporter> mocked =
                mockConstruction(DatasetCsvExporter.class)) {

            main.run("-d", "Other-Dataset", "--variables", "siblings_3, ,region", "-o",
                    "target/other.csv");

            DatasetCsvExporter exporter = mocked.constructed().get(0);
            // 空要素は除外されること
            verify(exporter).execute(eq("Other-Dataset"), eq(List.of("siblings_3", "region")),
                    eq(new File("target/other.csv")), any());
        }
    }

    @Test
    void run_異常ケース_データセット未指定時にErrorHandlerが呼ばれること() {
        exportConfig.setDataset(null);

        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            mocked.when(() -> ErrorHandler.usageError(anyString())).thenAnswer(inv -> {
                throw new IllegalStateException("exit");
            });

            assertThrows(IllegalStateException.class, () -> main.run());

            mocked.verify(() -> ErrorHandler.usageError(eq("Dataset name is required.")));
        }
    }

    @Test
    void run_異常ケース_変数未指定時にErrorHandlerが呼ばれること() {
        exportConfig.setVariables(List.of());

        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<DatasetCsvExporter> exporters =
                        mockConstruction(DatasetCsvExporter.class)) {

            main.run();

            mocked.verify(
                    () -> ErrorHandler.usageError(eq("At least one variable is required.")));
            assertTrue(exporters.constructed().isEmpty());
        }
    }

    @Test
    void run_異常ケース_出力先の値が欠けている場合にErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<DatasetCsvExporter> exporters =
                        mockConstruction(DatasetCsvExporter.class)) {

            // -o の後に値がない
            main.run("-o");

            mocked.verify(() -> ErrorHandler.usageError(eq("Output file is required.")));
            assertTrue(exporters.constructed().isEmpty());
        }
    }

    @Test
    void run_異常ケース_エクスポート失敗時にErrorHandlerが呼ばれること() throws Exception {
        ApiException error = new ApiException("dataset not found", 404, null);

        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<DatasetCsvExporter> exporters =
                        mockConstruction(DatasetCsvExporter.class, (mock, ctx) -> when(
                                mock.execute(anyString(), any(), any(), any())).thenThrow(error))) {

            main.run();

            mocked.verify(() -> ErrorHandler.exportFailed(eq("Teaching-Dataset"), eq(error)));
        }
    }

    @Test
    void run_正常ケース_healthはヘルスチェックのみ実行されること() throws Exception {
        Instant now = Instant.now();
        try (MockedConstruction<CantabularClient> clients =
                mockConstruction(CantabularClient.class, (mock, ctx) -> {
                    when(mock.checker()).thenReturn(new HealthCheckState("cantabular",
                            HealthCheckState.Status.OK, 200, "cantabular is ok", now));
                    when(mock.checkerApiExt()).thenReturn(new HealthCheckState(
                            "cantabularAPIExt", HealthCheckState.Status.CRITICAL, 0,
                            "connection refused", now));
                });
                MockedConstruction<DatasetCsvExporter> exporters =
                        mockConstruction(DatasetCsvExporter.class)) {

            main.run("--health");

            CantabularClient client = clients.constructed().get(0);
            verify(client).checker();
            verify(client).checkerApiExt();
            verify(client, never()).staticDatasetQueryStreamCsv(any(), any(), any());
            assertTrue(exporters.constructed().isEmpty());
        }
    }
}
