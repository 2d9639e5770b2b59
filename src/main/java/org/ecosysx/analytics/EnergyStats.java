package org.ecosysx.analytics;

/**
 * Energy distribution of one agent kind at a given step.
 *
 * @param mean     mean energy, rounded to one decimal.
 * @param count    number of agents.
 * @param pctAtCap percentage of agents at full energy, rounded to one decimal.
 */
public record EnergyStats(double mean, int count, double pctAtCap) {
}
