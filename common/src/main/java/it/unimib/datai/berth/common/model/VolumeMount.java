package it.unimib.datai.berth.common.model;

import java.time.Instant;

public record VolumeMount(
        String id,
        String name,
        String containerPath,
        String hostPath,
        VolumeMode mode,
        Instant createdAt
) {
    public VolumeMount {
        if (mode == null) {
            mode = VolumeMode.READ_WRITE;
        }
    }

    public boolean hostBound() {
        return hostPath != null;
    }
}
