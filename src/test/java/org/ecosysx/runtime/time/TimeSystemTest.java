package org.ecosysx.runtime.time;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class TimeSystemTest {

    @Test
    void referenceClockLeavesProbabilitiesUnchanged() {
        assertThat(TimeSystem.V1.stepProbability(0.002)).isCloseTo(0.002, within(1e-12));
        assertThat(TimeSystem.V1.stepProbability(0.3)).isCloseTo(0.3, within(1e-12));
    }

    @Test
    void longerStepsCompoundTheHourlyHazard() {
        TimeSystem sixHours = new TimeSystem(6.0);
        double expected = 1 - Math.pow(1 - 0.01, 6);

        assertThat(sixHours.stepProbability(0.01)).isCloseTo(expected, within(1e-12));
    }

    @Test
    void degenerateProbabilitiesAreClamped() {
        TimeSystem time = new TimeSystem(2.0);

        assertThat(time.stepProbability(0.0)).isZero();
        assertThat(time.stepProbability(-0.5)).isZero();
        assertThat(time.stepProbability(Double.NaN)).isZero();
        assertThat(time.stepProbability(1.0)).isEqualTo(1.0);
    }

    @Test
    void hazardProbabilityFollowsPoissonFormula() {
        assertThat(TimeSystem.hazardProbability(0.1, 1.0)).isCloseTo(1 - Math.exp(-0.1 / 24), within(1e-15));
        assertThat(TimeSystem.hazardProbability(0.0, 1.0)).isZero();
        assertThat(TimeSystem.hazardProbability(Double.POSITIVE_INFINITY, 1.0)).isZero();
        assertThat(TimeSystem.hazardProbability(0.1, -1.0)).isZero();
    }

    @Test
    void hazardProbabilityGrowsWithRateAndStepLength() {
        double[] rates = {0.01, 0.1, 1.0, 10.0, 100.0};
        for (int i = 1; i < rates.length; i++) {
            assertThat(TimeSystem.hazardProbability(rates[i], 1.0))
                    .isGreaterThan(TimeSystem.hazardProbability(rates[i - 1], 1.0));
        }
        double[] hours = {0.25, 1.0, 6.0, 24.0, 240.0};
        for (int i = 1; i < hours.length; i++) {
            assertThat(TimeSystem.hazardProbability(0.1, hours[i]))
                    .isGreaterThan(TimeSystem.hazardProbability(0.1, hours[i - 1]));
        }
    }

    @Test
    void hazardProbabilityApproachesOneForLargeRates() {
        assertThat(TimeSystem.hazardProbability(1_000.0, 1.0)).isCloseTo(1.0, within(1e-12));
        assertThat(TimeSystem.hazardProbability(1e6, 1.0)).isLessThanOrEqualTo(1.0);
    }

    @Test
    void hourlyClockRoundTripsStepCounts() {
        for (long n : new long[] {0, 1, 24, 1_000, 123_456_789}) {
            assertThat(TimeSystem.V1.hoursToSteps(TimeSystem.V1.stepToHours(n))).isEqualTo((double) n);
        }
        assertThat(TimeSystem.V1.daysToSteps(1)).isEqualTo(24.0);
    }

    @Test
    void convertsBetweenStepsAndCalendarTime() {
        TimeSystem time = new TimeSystem(0.5);

        assertThat(time.dtDays()).isCloseTo(0.5 / 24, within(1e-15));
        assertThat(time.stepToHours(10)).isEqualTo(5.0);
        assertThat(time.stepToDays(48)).isEqualTo(1.0);
        assertThat(time.hoursToSteps(3.0)).isEqualTo(6.0);
        assertThat(time.daysToSteps(1.0)).isEqualTo(48.0);
    }

    @Test
    void rejectsInvalidStepLength() {
        assertThatThrownBy(() -> new TimeSystem(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeSystem(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeSystem(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeSystem(Double.POSITIVE_INFINITY)).isInstanceOf(IllegalArgumentException.class);
    }
}
