package org.ecosysx.runtime.model;

public enum DeathCause {
    OLD_AGE("old_age"),
    STARVATION("starvation");

    private final String key;

    DeathCause(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
