package it.unimib.datai.berth.common.model;

public record HealthCheckSpec(
        HealthCheckKind kind,
        String value,
        Integer intervalSeconds,
        Integer timeoutSeconds
) {
    public HealthCheckSpec {
        if (kind == null) {
            kind = HealthCheckKind.PATH;
        }
        if (value == null || value.isBlank()) {
            value = "/";
        }
        if (intervalSeconds == null || intervalSeconds <= 0) {
            intervalSeconds = 15;
        }
        if (timeoutSeconds == null || timeoutSeconds <= 0) {
            timeoutSeconds = 60;
        }
    }

    public static HealthCheckSpec path(String path, int timeoutSeconds) {
        return new HealthCheckSpec(HealthCheckKind.PATH, path, null, timeoutSeconds);
    }

    public static HealthCheckSpec command(String command, int timeoutSeconds) {
        return new HealthCheckSpec(HealthCheckKind.COMMAND, command, null, timeoutSeconds);
    }
}
