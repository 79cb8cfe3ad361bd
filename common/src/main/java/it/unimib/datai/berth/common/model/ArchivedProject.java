package it.unimib.datai.berth.common.model;

import java.util.List;
import java.util.Objects;

public record ArchivedProject(String originalId, String slug, List<ArchivedService> services) {
    public ArchivedProject {
        Objects.requireNonNull(originalId, "originalId");
        services = services == null ? List.of() : List.copyOf(services);
    }

    public static ArchivedProject snapshotOf(String projectId, String slug, List<ArchivedService> services) {
        List<ArchivedService> owned = services == null ? List.of() : services.stream()
                .filter(s -> s.projectOriginalId().equals(projectId))
                .toList();
        return new ArchivedProject(projectId, slug, owned);
    }
}
