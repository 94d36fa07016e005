package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Share-price drawdown of one exposed vault across the crisis. Prices are in the vault's asset;
 * a drop means depositors realized part of the loss.
 */
@Value
@Builder
public class SharePriceImpact {
    VaultKey vaultKey;
    String vaultName;
    String curatorIdentity;
    String chainName;
    ExposureStatus exposureStatus;
    List<String> collateralSymbols;
    int dailyPoints;
    double peakSharePrice;
    long peakTs;
    double troughSharePrice;
    long troughTs;
    /** (peak - trough) / peak; 0 when the peak is not positive, negative when the price only rose. */
    double maxDrawdown;
    double latestSharePrice;
    long latestTs;
    /** Fraction of the drawdown recovered since the trough; null without a drawdown. */
    Double recovery;
    /** Relative price change over the depeg window; null when the window has no samples. */
    Double depegWindowDrop;
    Double tvlAtPeakUsd;
    Double tvlAtTroughUsd;
    Double tvlPreDepegUsd;
    /** Pre-depeg TVL times drawdown; null when the drawdown is negligible. */
    Double estimatedLossUsd;
}
