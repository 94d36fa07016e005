package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Vault {
    VaultKey key;
    String name;
    String symbol;
    String chainName;
    String assetSymbol;
    /** First resolved curator name, else the raw curator address. */
    String curatorIdentity;
    String curatorAddress;
    String owner;
    String guardian;
    double totalAssetsUsd;
    double sharePrice;
    double sharePriceUsd;
    long timelockSeconds;
    boolean hasPublicAllocator;
    List<VaultAllocation> allocations;
}
