/* (C)2026 */
package com.ammann.oscillation.model;

import java.util.List;

/**
 * Ordered, immutable sequence of samples in file order.
 *
 * <p>Time is assumed to increase monotonically but this is not verified.
 */
public record Trace(List<Sample> samples) {

    public Trace {
        samples = List.copyOf(samples);
    }

    public static Trace empty() {
        return new Trace(List.of());
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * Returns the sample times converted from seconds to microseconds.
     */
    public double[] timesMicros() {
        double[] times = new double[samples.size()];
        for (int i = 0; i < times.length; i++) {
            times[i] = samples.get(i).timeSeconds() * 1e6;
        }
        return times;
    }

    public double[] voltages() {
        double[] voltages = new double[samples.size()];
        for (int i = 0; i < voltages.length; i++) {
            voltages[i] = samples.get(i).voltage();
        }
        return voltages;
    }
}
