package com.depegscan.model;

public enum AttributionConfidence {
    CONFIRMED,
    /** Market guessed from the vault's chain because no touched market was recorded. */
    LOW_CONFIDENCE_FALLBACK
}
