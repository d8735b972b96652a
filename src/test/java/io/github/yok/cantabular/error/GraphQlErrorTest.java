package io.github.yok.cantabular.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class GraphQlErrorTest {

    private static GraphQlError error(String message) {
        return GraphQlError.builder().message(message).build();
    }

    @Test
    void statusCode_正常ケース_メッセージ先頭のステータスが返ること() {
        assertEquals(404, error("404 Not Found: dataset not loaded in this server").statusCode());
        assertEquals(400, error("400 Bad Request: unknown variable").statusCode());
    }

    @Test
    void statusCode_異常ケース_ステータスなし_502が返ること() {
        assertEquals(502, error("something went wrong").statusCode());
        assertEquals(502, error("40").statusCode());
        assertEquals(502, error(null).statusCode());
        // 数値だが HTTP ステータスとして定義されていない
        assertEquals(502, error("299 unknown").statusCode());
    }

    @Test
    void デシリアライズ_正常ケース_位置とパスが読み込まれること() throws Exception {
        String json = "[{\"message\":\"404 Not Found: x\",\"locations\":[{\"line\":2,\"column\":3}],"
                + "\"path\":[\"dataset\",0]}]";
        List<GraphQlError> errors = new ObjectMapper().readValue(json,
                new ObjectMapper().getTypeFactory().constructCollectionType(List.class,
                        GraphQlError.class));
        GraphQlError e = errors.get(0);
        assertEquals(2, e.getLocations().get(0).getLine());
        assertEquals(3, e.getLocations().get(0).getColumn());
        assertEquals(List.of("dataset", 0), e.getPath());
        assertEquals(404, e.statusCode());
    }
}
