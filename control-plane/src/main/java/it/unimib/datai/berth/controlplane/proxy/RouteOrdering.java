package it.unimib.datai.berth.controlplane.proxy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the path-scoped routes of a domain the way Caddy orders {@code handle} blocks:
 * longest path prefix first; for equal prefixes an exact path wins over a wildcard, then
 * the longer raw path. The sort is stable, so reapplying it is a no-op.
 */
public final class RouteOrdering {

    static final Comparator<String> PATH_SPECIFICITY = Comparator
            .comparingInt((String path) -> -normalize(path).length())
            .thenComparing(path -> path.endsWith("*"))
            .thenComparingInt(path -> -path.length());

    private RouteOrdering() {
    }

    public static List<JsonNode> sort(Iterable<JsonNode> routes) {
        List<JsonNode> sorted = new ArrayList<>();
        routes.forEach(sorted::add);
        sorted.sort(Comparator.comparing(RouteOrdering::matchPath, PATH_SPECIFICITY));
        return sorted;
    }

    static String matchPath(JsonNode route) {
        return route.path("match").path(0).path("path").path(0).asText("");
    }

    private static String normalize(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '*') {
            end--;
        }
        return path.substring(0, end);
    }
}
