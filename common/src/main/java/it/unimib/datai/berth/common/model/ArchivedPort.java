package it.unimib.datai.berth.common.model;

public record ArchivedPort(Integer host, int forwarded) {
    static ArchivedPort of(PortBinding port) {
        return new ArchivedPort(port.hostPort(), port.containerPort());
    }
}
