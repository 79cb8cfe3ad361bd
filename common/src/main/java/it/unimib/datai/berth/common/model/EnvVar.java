package it.unimib.datai.berth.common.model;

public record EnvVar(String key, String value) {
    public String asAssignment() {
        return key + "=" + (value == null ? "" : value);
    }
}
