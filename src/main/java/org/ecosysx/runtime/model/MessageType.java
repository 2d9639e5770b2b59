package org.ecosysx.runtime.model;

public enum MessageType {
    RESOURCE_TIP("resource_tip"),
    INFECTION_WARNING("infection_warning"),
    HELP_REQUEST("help_request"),
    ALLIANCE_REQUEST("alliance_request"),
    TRADE_OFFER("trade_offer");

    private final String key;

    MessageType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
