package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * One (vault, toxic market) row. At most one per pair after reconciliation.
 */
@Value
@Builder(toBuilder = true)
public class Exposure {
    VaultKey vaultKey;
    String vaultName;
    String curatorIdentity;
    String chainName;
    double vaultTotalAssetsUsd;
    MarketKey marketKey;
    String collateralSymbol;
    String loanSymbol;
    BigInteger supplyAssets;
    double supplyUsd;
    BigInteger supplyCap;
    double supplyCapUsd;
    /** Share of vault TVL held in this market, 0..1. */
    double exposurePct;
    Long removableAt;
    DiscoveryMethod discoveryMethod;
    AttributionConfidence attributionConfidence;
    ExposureStatus exposureStatus;
}
