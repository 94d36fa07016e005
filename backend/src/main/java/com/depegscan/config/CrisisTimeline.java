package com.depegscan.config;

import java.time.Instant;

/**
 * Reference instants of the analysed depeg, in epoch seconds.
 *
 * @param crisis reference "crisis" instant all response timings are measured against
 * @param preCrisisStart start of the week leading up to the crisis
 * @param windowStart start of the historical analysis window
 * @param windowEnd end of the historical analysis window
 */
public record CrisisTimeline(long crisis, long preCrisisStart, long windowStart, long windowEnd) {

    public static final long DAY_SECONDS = 86_400L;

    public CrisisTimeline {
        if (preCrisisStart > crisis) {
            throw new IllegalArgumentException("preCrisisStart must not be after crisis");
        }
        if (windowStart > windowEnd) {
            throw new IllegalArgumentException("windowStart must not be after windowEnd");
        }
    }

    public static CrisisTimeline from(AppProps.Crisis c) {
        return new CrisisTimeline(c.getTimestamp().getEpochSecond(), c.getPreCrisisStart().getEpochSecond(),
                c.getWindowStart().getEpochSecond(), c.getWindowEnd().getEpochSecond());
    }

    public Instant crisisInstant() {
        return Instant.ofEpochSecond(crisis);
    }

    public Instant windowStartInstant() {
        return Instant.ofEpochSecond(windowStart);
    }

    public Instant windowEndInstant() {
        return Instant.ofEpochSecond(windowEnd);
    }
}
