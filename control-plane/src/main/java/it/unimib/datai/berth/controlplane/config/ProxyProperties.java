package it.unimib.datai.berth.controlplane.config;

import it.unimib.datai.berth.controlplane.cluster.LabelSelector;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "berth.proxy")
public record ProxyProperties(
        String adminUrl,
        String serverName,
        String serverId,
        String authUpstream,
        String authIntrospectionPath,
        Long requestTimeoutMs,
        Integer maxWriteAttempts,
        String workloadLabel
) {
    static final String DEFAULT_WORKLOAD_LABEL = "berth.role=proxy";

    public ProxyProperties {
        if (workloadLabel != null && !workloadLabel.isBlank()) {
            parseLabel(workloadLabel);
        }
    }

    public String adminUrlOrDefault() {
        return adminUrl != null && !adminUrl.isBlank() ? adminUrl : "http://localhost:2019";
    }

    public String serverNameOrDefault() {
        return serverName != null && !serverName.isBlank() ? serverName : "berth";
    }

    public String serverIdOrDefault() {
        return serverId != null && !serverId.isBlank() ? serverId : "berth-server";
    }

    public String authUpstreamOrDefault() {
        return authUpstream != null && !authUpstream.isBlank() ? authUpstream : "berth-api:8000";
    }

    public String authIntrospectionPathOrDefault() {
        return authIntrospectionPath != null && !authIntrospectionPath.isBlank()
                ? authIntrospectionPath : "/api/auth/me/with-token";
    }

    public long requestTimeoutMsOrDefault() {
        return requestTimeoutMs != null && requestTimeoutMs > 0 ? requestTimeoutMs : 5000;
    }

    public int maxWriteAttemptsOrDefault() {
        return maxWriteAttempts != null && maxWriteAttempts > 0 ? maxWriteAttempts : 3;
    }

    /**
     * {@code key=value} label identifying the shared proxy workload.
     */
    public String workloadLabelOrDefault() {
        return workloadLabel != null && !workloadLabel.isBlank() ? workloadLabel.trim() : DEFAULT_WORKLOAD_LABEL;
    }

    public LabelSelector workloadSelector() {
        return parseLabel(workloadLabelOrDefault());
    }

    private static LabelSelector parseLabel(String label) {
        String trimmed = label.trim();
        int eq = trimmed.indexOf('=');
        if (eq <= 0 || eq == trimmed.length() - 1) {
            throw new IllegalArgumentException(
                    "berth.proxy.workload-label must be key=value with a non-empty key and value, got '" + label + "'");
        }
        return LabelSelector.of(trimmed.substring(0, eq), trimmed.substring(eq + 1));
    }
}
