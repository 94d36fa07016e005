package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/** One market entry of a vault's live allocation. */
@Value
@Builder
public class VaultAllocation {
    MarketKey marketKey;
    String collateralSymbol;
    String loanSymbol;
    BigInteger supplyAssets;
    double supplyAssetsUsd;
    BigInteger supplyCap;
    double supplyCapUsd;
    boolean enabled;
    /** Epoch seconds after which the market may be removed; null when no removal is pending. */
    Long removableAt;
    BigInteger pendingSupplyCap;
}
