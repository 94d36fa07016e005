package com.depegscan.model;

/**
 * Curator reaction speed, bucketed on days between earliest decisive action and the crisis.
 */
public enum ResponseClass {
    PROACTIVE,
    EARLY_REACTOR,
    LAST_MINUTE,
    DURING_CRISIS,
    SLOW_REACTOR,
    VERY_LATE,
    STAYED_EXPOSED,
    EXITED_TIMING_UNKNOWN,
    UNKNOWN;

    /**
     * Lower bounds are strict: exactly 7 days is EARLY_REACTOR, exactly 0 is DURING_CRISIS.
     */
    public static ResponseClass fromDaysBeforeCrisis(double days) {
        if (days > 7) return PROACTIVE;
        if (days > 1) return EARLY_REACTOR;
        if (days > 0) return LAST_MINUTE;
        if (days > -3) return DURING_CRISIS;
        if (days > -14) return SLOW_REACTOR;
        return VERY_LATE;
    }

    /** Class used when no decisive action could be dated. */
    public static ResponseClass withoutAction(ExposureStatus status) {
        if (status == null) return UNKNOWN;
        return status == ExposureStatus.ACTIVE_EXPOSURE ? STAYED_EXPOSED : EXITED_TIMING_UNKNOWN;
    }
}
