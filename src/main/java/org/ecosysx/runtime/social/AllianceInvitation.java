package org.ecosysx.runtime.social;

public record AllianceInvitation(String fromId, long timestamp) {
}
