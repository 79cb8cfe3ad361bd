package it.unimib.datai.berth.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "berth.reclaim")
public record ReclaimProperties(
        Integer drainTimeoutSeconds,
        Integer eventTimeoutSeconds,
        Long pollIntervalMs
) {
    public int drainTimeoutSecondsOrDefault() {
        return drainTimeoutSeconds != null && drainTimeoutSeconds > 0 ? drainTimeoutSeconds : 10;
    }

    public int eventTimeoutSecondsOrDefault() {
        return eventTimeoutSeconds != null && eventTimeoutSeconds > 0 ? eventTimeoutSeconds : 10;
    }

    public long pollIntervalMsOrDefault() {
        return pollIntervalMs != null && pollIntervalMs > 0 ? pollIntervalMs : 1000;
    }
}
