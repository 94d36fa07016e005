package com.depegscan.model;

public enum ExposureStatus {
    ACTIVE_EXPOSURE,
    FULLY_EXITED,
    STOPPED_SUPPLYING,
    WITHDREW_PRE_CRISIS,
    WITHDREW_DURING_CRISIS,
    HISTORICALLY_EXPOSED;

    /** Statuses that imply the vault left the market at some unknown point. */
    public boolean isExitedOrHistorical() {
        return this != ACTIVE_EXPOSURE;
    }
}
