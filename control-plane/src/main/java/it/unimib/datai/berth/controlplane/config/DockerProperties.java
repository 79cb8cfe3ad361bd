package it.unimib.datai.berth.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "berth.docker")
public record DockerProperties(
        String host,
        String apiVersion,
        Long connectTimeoutMs,
        Long requestTimeoutMs,
        Long pullTimeoutMs
) {
    public String apiVersionOrDefault() {
        return apiVersion != null && !apiVersion.isBlank() ? apiVersion : "v1.43";
    }

    public long connectTimeoutMsOrDefault() {
        return connectTimeoutMs != null && connectTimeoutMs > 0 ? connectTimeoutMs : 5000;
    }

    public long requestTimeoutMsOrDefault() {
        return requestTimeoutMs != null && requestTimeoutMs > 0 ? requestTimeoutMs : 30000;
    }

    public long pullTimeoutMsOrDefault() {
        return pullTimeoutMs != null && pullTimeoutMs > 0 ? pullTimeoutMs : 600000;
    }
}
