package io.github.yok.cantabular.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.cantabular.error.ApiException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class GraphQlJsonToCsvTest {

    private final GraphQlJsonToCsv transformer = new GraphQlJsonToCsv();

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private static final String ONE_DIM = "{\"count\":2,\"variable\":{\"name\":\"a\",\"label\":\"A\"},"
            + "\"categories\":[{\"code\":\"0\",\"label\":\"x\"},{\"code\":\"1\",\"label\":\"y\"}]}";

    @Test
    void transform_正常ケース_GraphQL応答がCSVに変換され行数が返ること() throws Exception {
        StringWriter out = new StringWriter();
        long rows = transformer.transform(json(TableFixtures.cityBySiblingsBySexJson()), out,
                CancellationToken.NONE);

        assertEquals(19, rows);
        List<String> lines = Arrays.asList(out.toString().split("\n"));
        assertEquals(TableFixtures.cityBySiblingsBySexCsv(), lines);
    }

    @Test
    void transform_正常ケース_未知のフィールドとcount省略を無視すること() throws Exception {
        String body = "{\"extensions\":{\"cost\":[1,2]},\"data\":{\"other\":1,\"dataset\":"
                + "{\"name\":\"ds\",\"table\":{\"dimensions\":[{\"variable\":{\"name\":\"a\","
                + "\"label\":\"A\"},\"categories\":[{\"code\":\"0\",\"label\":\"x\"}]}],"
                + "\"rules\":{\"x\":true},\"values\":[7]}}},\"errors\":null}";
        StringWriter out = new StringWriter();
        assertEquals(2, transformer.transform(json(body), out, CancellationToken.NONE));
        assertEquals("A,count\nx,7\n", out.toString());
    }

    @Test
    void transform_異常ケース_errors配列あり_ステータス付きApiExceptionが送出されること() {
        String body = "{\"data\":{\"dataset\":null},\"errors\":[{\"message\":"
                + "\"404 Not Found: dataset not loaded in this server\","
                + "\"locations\":[{\"line\":2,\"column\":2}],\"path\":[\"dataset\"]}]}";
        ApiException ex = assertThrows(ApiException.class,
                () -> transformer.transform(json(body), new StringWriter(), CancellationToken.NONE));
        assertEquals(404, ex.getStatusCode());
        assertEquals("error(s) returned by graphQL query", ex.getMessage());
        assertTrue(ex.getLogData().containsKey("errors"));
    }

    @Test
    void transform_異常ケース_テーブルエラーあり_出力せずApiExceptionが送出されること() {
        String body = "{\"data\":{\"dataset\":{\"table\":{\"dimensions\":[" + ONE_DIM
                + "],\"values\":null,\"error\":\"withinMaxCells\"}}}}";
        StringWriter out = new StringWriter();
        ApiException ex = assertThrows(ApiException.class,
                () -> transformer.transform(json(body), out, CancellationToken.NONE));
        assertEquals(400, ex.getStatusCode());
        assertEquals("GraphQL error: resulting dataset too large", ex.getMessage());
        assertEquals("", out.toString());
    }

    @Test
    void transform_異常ケース_値の件数が不足_TableShapeExceptionが送出されること() {
        String body = "{\"data\":{\"dataset\":{\"table\":{\"dimensions\":[" + ONE_DIM
                + "],\"values\":[1]}}}}";
        TableShapeException ex = assertThrows(TableShapeException.class,
                () -> transformer.transform(json(body), new StringWriter(), CancellationToken.NONE));
        assertTrue(ex.getMessage().startsWith("table shape mismatch"));
    }

    @Test
    void transform_異常ケース_値の件数が超過_TableShapeExceptionが送出されること() {
        String body = "{\"data\":{\"dataset\":{\"table\":{\"dimensions\":[" + ONE_DIM
                + "],\"values\":[1,2,3]}}}}";
        assertThrows(TableShapeException.class,
                () -> transformer.transform(json(body), new StringWriter(), CancellationToken.NONE));
    }

    @Test
    void transform_異常ケース_valuesがdimensionsより先_TableShapeExceptionが送出されること() {
        String body = "{\"data\":{\"dataset\":{\"table\":{\"values\":[1,2],\"dimensions\":["
                + ONE_DIM + "]}}}}";
        TableShapeException ex = assertThrows(TableShapeException.class,
                () -> transformer.transform(json(body), new StringWriter(), CancellationToken.NONE));
        assertEquals("table values received before dimensions", ex.getMessage());
    }

    @Test
    void transform_異常ケース_テーブルなし_TableShapeExceptionが送出されること() {
        assertThrows(TableShapeException.class, () -> transformer
                .transform(json("{\"data\":{\"dataset\":null}}"), new StringWriter(),
                        CancellationToken.NONE));
    }

    @Test
    void transform_異常ケース_不正なJSON_ステータス500のApiExceptionが送出されること() {
        ApiException ex = assertThrows(ApiException.class, () -> transformer
                .transform(json("{\"data\":{\"dataset\":"), new StringWriter(),
                        CancellationToken.NONE));
        assertEquals(500, ex.getStatusCode());
    }

    @Test
    void transform_異常ケース_キャンセル済みトークン_行を出力せず0行が報告されること() {
        CancellationToken token = CancellationToken.create();
        token.cancel(new CancellationException("client went away"));
        StringWriter out = new StringWriter();
        TableCanceledException ex = assertThrows(TableCanceledException.class, () -> transformer
                .transform(json(TableFixtures.cityBySiblingsBySexJson()), out, token));
        assertEquals(0, ex.getRowsWritten());
        assertEquals("", out.toString());
        assertEquals("client went away", ex.getCause().getMessage());
    }

    @Test
    void transform_異常ケース_途中でキャンセル_書き込み済みの行がフラッシュされ行数が報告されること() {
        CancellationToken token = CancellationToken.create();
        StringWriter sink = new StringWriter();
        // 5行目(ヘッダ含む)を書いた時点でキャンセルする
        Writer out = new Writer() {
            private int newlines;

            @Override
            public void write(char[] cbuf, int off, int len) {
                for (int i = off; i < off + len; i++) {
                    if (cbuf[i] == '\n' && ++newlines == 5) {
                        token.cancel();
                    }
                }
                sink.write(cbuf, off, len);
            }

            @Override
            public void flush() {}

            @Override
            public void close() {}
        };

        TableCanceledException ex = assertThrows(TableCanceledException.class, () -> transformer
                .transform(json(TableFixtures.cityBySiblingsBySexJson()), out, token));
        assertEquals(5, ex.getRowsWritten());
        assertEquals(TableFixtures.cityBySiblingsBySexCsv().subList(0, 5),
                Arrays.asList(sink.toString().split("\n")));
    }

    @Test
    void transform_正常ケース_入力ストリームはクローズされないこと() throws Exception {
        AtomicBoolean closed = new AtomicBoolean();
        InputStream body = new ByteArrayInputStream(
                TableFixtures.cityBySiblingsBySexJson().getBytes(StandardCharsets.UTF_8)) {
            @Override
            public void close() {
                closed.set(true);
            }
        };

        transformer.transform(body, new StringWriter(), CancellationToken.NONE);

        assertFalse(closed.get());
    }

    @Test
    void transform_正常ケース_カテゴリ0件でvaluesがnull_ヘッダのみ出力されること() throws Exception {
        String body = "{\"data\":{\"dataset\":{\"table\":{\"dimensions\":[{\"variable\":"
                + "{\"name\":\"a\",\"label\":\"A\"},\"categories\":[]}],\"values\":null,"
                + "\"error\":null}}}}";
        StringWriter out = new StringWriter();

        assertEquals(1, transformer.transform(json(body), out, CancellationToken.NONE));
        assertEquals("A,count\n", out.toString());
    }
}
