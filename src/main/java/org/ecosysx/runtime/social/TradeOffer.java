package org.ecosysx.runtime.social;

/**
 * An energy trade proposed by one agent to another. Evaluated once by the recipient.
 */
public final class TradeOffer {

    private final String traderId;
    private final double offerEnergy;
    private final double wantEnergy;
    private final long timestamp;
    private boolean evaluated;

    public TradeOffer(String traderId, double offerEnergy, double wantEnergy, long timestamp) {
        this.traderId = traderId;
        this.offerEnergy = offerEnergy;
        this.wantEnergy = wantEnergy;
        this.timestamp = timestamp;
    }

    public String getTraderId() {
        return traderId;
    }

    public double getOfferEnergy() {
        return offerEnergy;
    }

    public double getWantEnergy() {
        return wantEnergy;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isEvaluated() {
        return evaluated;
    }

    void markEvaluated() {
        this.evaluated = true;
    }
}
