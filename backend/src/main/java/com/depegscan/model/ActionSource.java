package com.depegscan.model;

/** Evidence stream that dated a curator's earliest decisive action. */
public enum ActionSource {
    ALLOCATION_ZERO,
    CAP_ZERO,
    TOXIC_WITHDRAW
}
