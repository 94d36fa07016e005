package com.depegscan.model;

/** Daily allocation level of a vault in one market. */
public record AllocationPoint(MarketKey marketKey, long timestamp, double supplyUsd) {
}
