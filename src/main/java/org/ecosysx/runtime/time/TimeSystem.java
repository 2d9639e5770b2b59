package org.ecosysx.runtime.time;

/**
 * Immutable mapping between simulation ticks and simulated time.
 * <p>
 * All per-tick transition probabilities in the runtime are calibrated against a reference step
 * of one hour. Components receive a single {@code TimeSystem} instance at construction and convert
 * their reference probabilities through {@link #stepProbability(double)} so that changing the step
 * length keeps the underlying continuous-time hazard unchanged.
 */
public final class TimeSystem {

    /** Hours per reference step against which per-step probabilities are calibrated. */
    public static final double REFERENCE_STEP_HOURS = 1.0;

    /** The default clock: one tick is one simulated hour. */
    public static final TimeSystem V1 = new TimeSystem(REFERENCE_STEP_HOURS);

    private static final double HOURS_PER_DAY = 24.0;

    private final double stepHours;

    /**
     * Creates a clock with the given step length.
     *
     * @param stepHours simulated hours per tick, must be finite and positive.
     * @throws IllegalArgumentException if {@code stepHours} is not finite or not positive.
     */
    public TimeSystem(double stepHours) {
        if (!Double.isFinite(stepHours) || stepHours <= 0) {
            throw new IllegalArgumentException("stepHours must be finite and positive, got " + stepHours);
        }
        this.stepHours = stepHours;
    }

    public double getStepHours() {
        return stepHours;
    }

    public double dtDays() {
        return stepHours / HOURS_PER_DAY;
    }

    public double stepToHours(long steps) {
        return steps * stepHours;
    }

    public double stepToDays(long steps) {
        return steps * stepHours / HOURS_PER_DAY;
    }

    public double hoursToSteps(double hours) {
        return hours / stepHours;
    }

    public double daysToSteps(double days) {
        return days * HOURS_PER_DAY / stepHours;
    }

    /**
     * Converts a probability calibrated per reference step into the probability for one step of
     * this clock. The identity for {@link #V1}.
     *
     * @param referenceProbability probability per one-hour step.
     * @return probability per configured step, in [0, 1].
     */
    public double stepProbability(double referenceProbability) {
        if (!(referenceProbability > 0)) {
            return 0.0;
        }
        if (referenceProbability >= 1) {
            return 1.0;
        }
        double ratePerDay = -Math.log1p(-referenceProbability) * HOURS_PER_DAY / REFERENCE_STEP_HOURS;
        return hazardProbability(ratePerDay, stepHours);
    }

    /**
     * Probability that at least one event of a Poisson process with the given daily rate occurs
     * within one step: {@code 1 - exp(-rate * stepHours / 24)}.
     *
     * @param ratePerDay event rate per simulated day.
     * @param stepHours  step length in hours.
     * @return the per-step probability, or 0 for non-finite or non-positive inputs.
     */
    public static double hazardProbability(double ratePerDay, double stepHours) {
        if (!Double.isFinite(ratePerDay) || ratePerDay <= 0) {
            return 0.0;
        }
        if (!Double.isFinite(stepHours) || stepHours <= 0) {
            return 0.0;
        }
        return 1.0 - Math.exp(-ratePerDay * stepHours / HOURS_PER_DAY);
    }

    @Override
    public String toString() {
        return "TimeSystem[stepHours=" + stepHours + "]";
    }
}
