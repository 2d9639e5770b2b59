package org.ecosysx.runtime.social;

/**
 * Mutual support pact between two social agents. Each side holds its own instance.
 */
public final class Alliance {

    public static final double INITIAL_STRENGTH = 0.7;
    public static final double SHARING_RATE = 0.3;
    public static final double DISSOLVE_BELOW = 0.2;

    private final String partnerId;
    private final long formedAt;
    private double strength = INITIAL_STRENGTH;
    private double energyShared;

    public Alliance(String partnerId, long formedAt) {
        this.partnerId = partnerId;
        this.formedAt = formedAt;
    }

    public String getPartnerId() {
        return partnerId;
    }

    public long getFormedAt() {
        return formedAt;
    }

    public double getStrength() {
        return strength;
    }

    public double getSharingRate() {
        return SHARING_RATE;
    }

    public double getEnergyShared() {
        return energyShared;
    }

    void adjustStrength(double delta) {
        strength = Math.max(0.0, Math.min(1.0, strength + delta));
    }

    void recordShared(double amount) {
        energyShared += amount;
    }

    boolean isBroken() {
        return strength < DISSOLVE_BELOW;
    }
}
