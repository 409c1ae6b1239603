/* (C)2026 */
package com.ammann.oscillation.model;

/**
 * Parameters of the exponential envelope {@code y(t) = A * exp(beta * t) + C}.
 *
 * <p>{@code beta} is expressed per microsecond and is negative for a decaying envelope.
 * {@code offset} is the un-normalized baseline, not a regression output.
 *
 * @param amplitude envelope amplitude A above the baseline at t = 0
 * @param beta      exponential rate per microsecond
 * @param offset    baseline C in volts
 */
public record FitParams(double amplitude, double beta, double offset) {

    public boolean isGrowing() {
        return beta > 0;
    }
}
