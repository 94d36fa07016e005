package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class BadDebtAssessment {
    MarketKey marketKey;
    String chainName;
    String collateralSymbol;
    String loanSymbol;
    double supplyUsd;
    double borrowUsd;
    double collateralUsd;
    double utilization;

    // layer 1: accounting gap
    BigInteger gapRaw;
    double gapUsd;
    double layer1LossUsd;
    double layer1LossPctOfSupply;
    BigInteger liquidityDiscrepancyRaw;

    // layer 2: protocol-reported
    double badDebtUsd;
    double realizedBadDebtUsd;
    double layer2TotalUsd;

    // layer 3: oracle vs spot; null when undefined
    Double oracleImpliedPriceUsd;
    Double collateralSpotUsd;
    Double oracleDeviation;
    Double mispricingExposureUsd;
    Double trueLtv;
    Double displayedLtv;
    double lltv;
    boolean oracleHardcoded;
    boolean oracleVaultBased;
    String oracleType;

    BadDebtStatus status;
    boolean oracleMasking;
    double bestEstimateUsd;
}
