package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Snapshot of a market's balances. Raw amounts are in token base units.
 */
@Value
@Builder
public class MarketState {
    Long timestamp;
    BigInteger supplyAssets;
    BigInteger borrowAssets;
    BigInteger collateralAssets;
    BigInteger liquidityAssets;
    double supplyUsd;
    double borrowUsd;
    double collateralUsd;
    double liquidityUsd;
    double utilization;
    /** Oracle price of one collateral unit in loan units, scaled by 1e36. Zero when unknown. */
    BigInteger oraclePrice;
}
