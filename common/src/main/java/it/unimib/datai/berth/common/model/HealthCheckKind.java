package it.unimib.datai.berth.common.model;

public enum HealthCheckKind {
    COMMAND,
    PATH
}
