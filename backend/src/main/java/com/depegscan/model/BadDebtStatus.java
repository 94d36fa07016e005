package com.depegscan.model;

/** Ordered: the first matching rule wins. */
public enum BadDebtStatus {
    BAD_DEBT_CONFIRMED,
    AT_RISK_FULL_UTILIZATION,
    ORACLE_MISPRICING,
    BAD_DEBT_NATIVE_REPORTED,
    HEALTHY
}
