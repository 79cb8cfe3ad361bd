package it.unimib.datai.berth.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "berth.healthcheck")
public record HealthCheckProperties(
        Integer defaultTimeoutSeconds,
        Double waitIntervalSeconds,
        Integer probeRequestCapSeconds,
        String probeScheme
) {
    public int defaultTimeoutSecondsOrDefault() {
        return defaultTimeoutSeconds != null && defaultTimeoutSeconds > 0 ? defaultTimeoutSeconds : 60;
    }

    public double waitIntervalSecondsOrDefault() {
        return waitIntervalSeconds != null && waitIntervalSeconds > 0 ? waitIntervalSeconds : 1.0;
    }

    public int probeRequestCapSecondsOrDefault() {
        return probeRequestCapSeconds != null && probeRequestCapSeconds > 0 ? probeRequestCapSeconds : 5;
    }

    public String probeSchemeOrDefault() {
        return probeScheme != null && !probeScheme.isBlank() ? probeScheme : "http";
    }
}
