package org.ecosysx.runtime.model;

public enum ActionType {
    FORAGE("forage"),
    AVOID("avoid"),
    REPRODUCE("reproduce"),
    REST("rest"),
    EXPLORE("explore");

    private final String key;

    ActionType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
