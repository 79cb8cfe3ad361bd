package it.unimib.datai.berth.controlplane.proxy;

/**
 * Deterministic ids of route nodes in the proxy config tree.
 */
public final class RouteIds {
    private RouteIds() {
    }

    /**
     * {@code <domain>-<path segments joined by '-'>}, {@code <domain>-*} for the root path.
     */
    public static String routeId(String domain, String basePath) {
        String normalized = stripSlashes(basePath, true, true).replace('/', '-');
        if (normalized.isEmpty()) {
            normalized = "*";
        }
        return domain + "-" + normalized;
    }

    /**
     * The base path without its trailing slash, i.e. the prefix matched and optionally
     * stripped by the proxy. The root path yields the empty string.
     */
    public static String pathPrefix(String basePath) {
        return stripSlashes(basePath, false, true);
    }

    static String stripSlashes(String path, boolean start, boolean end) {
        String result = path == null ? "" : path;
        if (start && result.startsWith("/")) {
            result = result.substring(1);
        }
        if (end && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
