package com.depegscan.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Counts and outcome of one pipeline run, as reported by the REST endpoint. */
@Value
@Builder
public class PipelineSummary {
    Instant startedAt;
    Instant finishedAt;
    int toxicMarkets;
    int currentAllocationVaults;
    int historicalVaults;
    int backfilledVaults;
    int exposures;
    int lowConfidenceExposures;
    int badDebtAssessments;
    int confirmedBadDebtMarkets;
    double bestEstimateBadDebtUsd;
    int curatorProfiles;
    int stressProfiles;
    int sharePriceImpacts;
    double estimatedShareholderLossUsd;
    int liquidationSummaries;
    int marketsWithoutLiquidations;
    int multiMarketVaults;
    String outputDir;
    List<String> failedStages;
}
