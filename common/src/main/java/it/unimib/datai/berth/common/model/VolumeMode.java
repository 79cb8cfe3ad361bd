package it.unimib.datai.berth.common.model;

public enum VolumeMode {
    READ_ONLY,
    READ_WRITE;

    public boolean readOnly() {
        return this == READ_ONLY;
    }
}
