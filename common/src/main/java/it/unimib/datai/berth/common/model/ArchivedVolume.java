package it.unimib.datai.berth.common.model;

public record ArchivedVolume(
        String originalId,
        String name,
        String containerPath,
        String hostPath,
        VolumeMode mode
) {
    static ArchivedVolume of(VolumeMount volume) {
        return new ArchivedVolume(volume.id(), volume.name(), volume.containerPath(), volume.hostPath(), volume.mode());
    }
}
