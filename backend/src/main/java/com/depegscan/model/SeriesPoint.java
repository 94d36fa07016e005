package com.depegscan.model;

/** Generic time-series sample, timestamp in epoch seconds. */
public record SeriesPoint(long timestamp, double value) {
}
