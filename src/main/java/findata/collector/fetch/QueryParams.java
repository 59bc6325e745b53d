package findata.collector.fetch;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Query parameter helpers shared by scheduled and manual fetches.
 */
public final class QueryParams {

    private QueryParams() {
    }

    /**
     * Overlay {@code extra} on {@code base}; extra wins on key collision.
     * Iteration order is base keys first, then new extra keys.
     */
    public static Map<String, String> merge(Map<String, String> base, Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (extra != null) {
            merged.putAll(extra);
        }
        return merged;
    }

    /**
     * Append encoded parameters to {@code url}, keeping any query it already has.
     */
    public static URI appendTo(String url, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return URI.create(url);
        }
        String query = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));

        int fragmentAt = url.indexOf('#');
        String base = fragmentAt >= 0 ? url.substring(0, fragmentAt) : url;
        String fragment = fragmentAt >= 0 ? url.substring(fragmentAt) : "";

        String separator;
        if (!base.contains("?")) {
            separator = "?";
        } else if (base.endsWith("?") || base.endsWith("&")) {
            separator = "";
        } else {
            separator = "&";
        }
        return URI.create(base + separator + query + fragment);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
