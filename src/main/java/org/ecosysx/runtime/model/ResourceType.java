package org.ecosysx.runtime.model;

public enum ResourceType {
    BERRY("berry"),
    MINERAL("mineral"),
    MUSHROOM("mushroom"),
    SEED("seed");

    private final String key;

    ResourceType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
