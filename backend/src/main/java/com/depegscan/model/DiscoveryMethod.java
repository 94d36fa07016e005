package com.depegscan.model;

/** Discovery path that produced an exposure row. */
public enum DiscoveryMethod {
    CURRENT_ALLOCATION("current_allocation"),
    HISTORICAL_REALLOCATION("historical_reallocation"),
    INDIVIDUAL_BACKFILL("individual_backfill");

    private final String label;

    DiscoveryMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isLive() {
        return this != HISTORICAL_REALLOCATION;
    }
}
