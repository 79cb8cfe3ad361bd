package it.unimib.datai.berth.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "berth.platform")
public record PlatformProperties(String privateDomain) {
    public String privateDomainOrDefault() {
        return privateDomain != null && !privateDomain.isBlank() ? privateDomain : "berth.internal";
    }
}
