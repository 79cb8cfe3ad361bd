package it.unimib.datai.berth.common.model;

import java.util.Locale;

public enum DeploymentSlot {
    BLUE,
    GREEN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public DeploymentSlot other() {
        return this == BLUE ? GREEN : BLUE;
    }
}
