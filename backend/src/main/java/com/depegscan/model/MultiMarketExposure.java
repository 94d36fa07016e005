package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** A vault exposed to more than one toxic market. */
@Value
@Builder
public class MultiMarketExposure {
    VaultKey vaultKey;
    String vaultName;
    String curatorIdentity;
    String chainName;
    double vaultTotalAssetsUsd;
    int toxicMarketCount;
    List<String> collateralSymbols;
    double totalToxicSupplyUsd;
    /** Sum of per-market exposure shares, 0..1. */
    double combinedExposurePct;
    int activeExposures;
}
