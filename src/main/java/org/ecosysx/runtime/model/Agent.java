package org.ecosysx.runtime.model;

import org.ecosysx.runtime.learning.ReinforcementLearningPolicy;
import org.ecosysx.runtime.social.SocialExtension;
import org.ecosysx.runtime.spi.IRandomProvider;

/**
 * A single simulated agent.
 * <p>
 * The record of an agent is shared by all kinds; kind-specific capability is attached as an
 * optional {@link SocialExtension}, present exactly when {@link #getKind()} is social. Age is never
 * stored and is always derived from the birth step.
 * <p>
 * Invariants maintained by the mutators: energy stays in [0, 100], cooldowns never go negative,
 * and the health status only moves forward.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. Agents are mutated only by the tick thread.
 */
public final class Agent {

    public static final double MAX_ENERGY = 100.0;
    public static final double MIN_ENERGY = 0.0;
    public static final double DEFAULT_BOUNDS = 20.0;

    private final int serial;
    private final String id;
    private final AgentKind kind;
    private final Genotype genotype;
    private final Phenotype phenotype;
    private final long birthStep;
    private final IRandomProvider random;
    private final ReinforcementLearningPolicy learningPolicy;
    private final SocialExtension social;

    private double x;
    private double y;
    private double z;
    private double vx;
    private double vz;
    private double energy = MAX_ENERGY;
    private HealthStatus status = HealthStatus.SUSCEPTIBLE;
    private int infectionTimer;
    private int reproductionCooldown;
    private DeathCause deathCause;

    private Agent(int serial, AgentKind kind, Vector3 position, Genotype genotype, long birthStep, IRandomProvider random) {
        this.serial = serial;
        this.id = kind.getIdPrefix() + "-" + serial;
        this.kind = kind;
        this.x = position.x();
        this.y = position.y();
        this.z = position.z();
        this.random = random;
        this.genotype = genotype != null ? genotype : Genotype.random(random);
        this.phenotype = Phenotype.express(this.genotype);
        this.birthStep = birthStep;
        this.learningPolicy = new ReinforcementLearningPolicy(random.deriveFor("policy", serial));
        this.social = kind.isSocial() ? new SocialExtension(random.deriveFor("social", serial)) : null;
    }

    /**
     * Creates an agent with its own random stream derived from {@code root}.
     *
     * @param serial    unique serial number within the run.
     * @param kind      the agent variant.
     * @param position  initial position.
     * @param genotype  inherited genotype, or {@code null} to sample a random one.
     * @param birthStep tick of creation.
     * @param root      the simulation's root random provider.
     * @return the new agent.
     */
    public static Agent create(int serial, AgentKind kind, Vector3 position, Genotype genotype, long birthStep, IRandomProvider root) {
        return new Agent(serial, kind, position, genotype, birthStep, root.deriveFor("agent", serial));
    }

    public int getSerial() {
        return serial;
    }

    public String getId() {
        return id;
    }

    public AgentKind getKind() {
        return kind;
    }

    public Genotype getGenotype() {
        return genotype;
    }

    public Phenotype getPhenotype() {
        return phenotype;
    }

    public long getBirthStep() {
        return birthStep;
    }

    public long getAge(long currentTick) {
        return Math.max(0L, currentTick - birthStep);
    }

    public double getLifespan() {
        return genotype.lifespan();
    }

    public IRandomProvider getRandom() {
        return random;
    }

    public ReinforcementLearningPolicy getLearningPolicy() {
        return learningPolicy;
    }

    /**
     * Returns the social capability, or {@code null} for non-social kinds.
     */
    public SocialExtension getSocial() {
        return social;
    }

    public Vector3 getPosition() {
        return new Vector3(x, y, z);
    }

    public double getX() {
        return x;
    }

    public double getZ() {
        return z;
    }

    public Vector3 getVelocity() {
        return new Vector3(vx, 0, vz);
    }

    public void setPosition(double x, double z) {
        this.x = x;
        this.z = z;
    }

    public double distanceTo(Agent other) {
        double dx = x - other.x;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dz * dz);
    }

    public double distanceTo(Vector3 point) {
        double dx = x - point.x();
        double dz = z - point.z();
        return Math.sqrt(dx * dx + dz * dz);
    }

    public void addVelocity(double dvx, double dvz) {
        this.vx += dvx;
        this.vz += dvz;
    }

    /**
     * Integrates velocity into position, applies damping and reflects off the square boundary.
     */
    public void integrate(double bounds) {
        x += vx;
        z += vz;
        vx *= 0.8;
        vz *= 0.8;
        if (Math.abs(x) > bounds) {
            x = Math.signum(x) * bounds;
            vx *= -0.5;
        }
        if (Math.abs(z) > bounds) {
            z = Math.signum(z) * bounds;
            vz *= -0.5;
        }
    }

    public double getEnergy() {
        return energy;
    }

    /**
     * Adds {@code delta} to the energy, clamping the result to [0, 100].
     *
     * @return the energy actually added (negative when removed).
     */
    public double addEnergy(double delta) {
        double before = energy;
        energy = clampEnergy(energy + delta);
        return energy - before;
    }

    public void setEnergy(double value) {
        energy = clampEnergy(value);
    }

    public HealthStatus getStatus() {
        return status;
    }

    public boolean isInfected() {
        return status == HealthStatus.INFECTED;
    }

    public boolean isSusceptible() {
        return status == HealthStatus.SUSCEPTIBLE;
    }

    /**
     * Moves a susceptible agent to INFECTED and resets its infection timer.
     *
     * @return true if the agent was susceptible and is now infected.
     */
    public boolean infect() {
        if (status != HealthStatus.SUSCEPTIBLE) {
            return false;
        }
        status = HealthStatus.INFECTED;
        infectionTimer = 0;
        return true;
    }

    /**
     * Moves an infected agent to RECOVERED.
     *
     * @return true if the agent was infected and is now recovered.
     */
    public boolean recover() {
        if (status != HealthStatus.INFECTED) {
            return false;
        }
        status = HealthStatus.RECOVERED;
        return true;
    }

    public int getInfectionTimer() {
        return infectionTimer;
    }

    public void setInfectionTimer(int infectionTimer) {
        this.infectionTimer = Math.max(0, infectionTimer);
    }

    public void incrementInfectionTimer() {
        infectionTimer++;
    }

    public int getReproductionCooldown() {
        return reproductionCooldown;
    }

    public void setReproductionCooldown(int cooldown) {
        this.reproductionCooldown = Math.max(0, cooldown);
    }

    public DeathCause getDeathCause() {
        return deathCause;
    }

    public void setDeathCause(DeathCause deathCause) {
        this.deathCause = deathCause;
    }

    private static double clampEnergy(double value) {
        return Math.max(MIN_ENERGY, Math.min(MAX_ENERGY, value));
    }

    @Override
    public String toString() {
        return "Agent[" + id + ", " + status.getLabel() + ", energy=" + String.format("%.1f", energy) + "]";
    }
}
