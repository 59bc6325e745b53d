package findata.collector.fetch;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryParamsTest {

    @Test
    void extraWinsOnCollision() {
        Map<String, String> merged = QueryParams.merge(Map.of("a", "1"), orderedOf("a", "2", "b", "3"));

        assertEquals(Map.of("a", "2", "b", "3"), merged);
    }

    @Test
    void mergeKeepsBaseOrderFirst() {
        Map<String, String> merged = QueryParams.merge(orderedOf("x", "1", "y", "2"), orderedOf("z", "3", "x", "9"));

        assertEquals(List.of("x", "y", "z"), List.copyOf(merged.keySet()));
        assertEquals("9", merged.get("x"));
    }

    @Test
    void mergeToleratesNulls() {
        assertTrue(QueryParams.merge(null, null).isEmpty());
        assertEquals(Map.of("a", "1"), QueryParams.merge(null, Map.of("a", "1")));
    }

    @Test
    void appendsToPlainUrl() {
        URI uri = QueryParams.appendTo("http://h/api", orderedOf("lang", "en", "page", "2"));

        assertEquals("http://h/api?lang=en&page=2", uri.toString());
    }

    @Test
    void keepsExistingQueryAndFragment() {
        URI uri = QueryParams.appendTo("http://h/api?fixed=1#top", Map.of("q", "x"));

        assertEquals("http://h/api?fixed=1&q=x#top", uri.toString());
    }

    @Test
    void encodesValues() {
        URI uri = QueryParams.appendTo("http://h/api", Map.of("name", "a b&c"));

        assertEquals("name=a+b%26c", uri.getRawQuery());
    }

    @Test
    void noParamsLeavesUrlUntouched() {
        assertEquals("http://h/api?x=1", QueryParams.appendTo("http://h/api?x=1", Map.of()).toString());
    }

    private static Map<String, String> orderedOf(String... kv) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            map.put(kv[i], kv[i + 1]);
        }
        return map;
    }
}
