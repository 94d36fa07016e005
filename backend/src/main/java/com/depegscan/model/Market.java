package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Market {
    MarketKey key;
    String chainName;
    boolean listed;
    Asset collateralAsset;
    Asset loanAsset;
    /** Liquidation LTV as a fraction. */
    double lltv;
    OracleDescriptor oracle;
    MarketState state;
    double badDebtUsd;
    double realizedBadDebtUsd;
    List<String> warningTypes;
    int supplyingVaultCount;

    public String collateralSymbol() {
        return collateralAsset == null ? null : collateralAsset.getSymbol();
    }

    public String loanSymbol() {
        return loanAsset == null ? null : loanAsset.getSymbol();
    }
}
