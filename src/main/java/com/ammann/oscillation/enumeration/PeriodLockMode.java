/* (C)2026 */
package com.ammann.oscillation.enumeration;

import java.util.Locale;

/**
 * Reference period used when validating successive zero crossings.
 *
 * <p>Both modes stop at the first crossing whose period falls outside the tolerance,
 * so the validated crossings are always a contiguous prefix of the detected ones.
 */
public enum PeriodLockMode
{
    /** Reference is the first measured period. */
    FIRST_PERIOD,
    /** Reference is the mean of all periods accepted so far. */
    RUNNING_AVERAGE;

    /**
     * Parses a mode name case-insensitively, accepting dashes in place of underscores.
     *
     * @throws IllegalArgumentException if the name matches no mode
     */
    public static PeriodLockMode fromName(String name) {
        return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
