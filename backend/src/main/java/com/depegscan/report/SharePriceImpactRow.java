package com.depegscan.report;

import com.depegscan.model.SharePriceImpact;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"chain_id", "chain", "vault_address", "vault_name", "curator", "exposure_status",
        "collateral_symbols", "daily_points", "peak_share_price", "peak_ts", "trough_share_price", "trough_ts",
        "max_drawdown", "latest_share_price", "latest_ts", "recovery", "depeg_window_drop", "tvl_at_peak_usd",
        "tvl_at_trough_usd", "tvl_pre_depeg_usd", "estimated_loss_usd"})
public class SharePriceImpactRow {
    @JsonProperty("chain_id") long chainId;
    @JsonProperty("chain") String chain;
    @JsonProperty("vault_address") String vaultAddress;
    @JsonProperty("vault_name") String vaultName;
    @JsonProperty("curator") String curator;
    @JsonProperty("exposure_status") String exposureStatus;
    @JsonProperty("collateral_symbols") String collateralSymbols;
    @JsonProperty("daily_points") int dailyPoints;
    @JsonProperty("peak_share_price") double peakSharePrice;
    @JsonProperty("peak_ts") long peakTs;
    @JsonProperty("trough_share_price") double troughSharePrice;
    @JsonProperty("trough_ts") long troughTs;
    @JsonProperty("max_drawdown") double maxDrawdown;
    @JsonProperty("latest_share_price") double latestSharePrice;
    @JsonProperty("latest_ts") long latestTs;
    @JsonProperty("recovery") Double recovery;
    @JsonProperty("depeg_window_drop") Double depegWindowDrop;
    @JsonProperty("tvl_at_peak_usd") Double tvlAtPeakUsd;
    @JsonProperty("tvl_at_trough_usd") Double tvlAtTroughUsd;
    @JsonProperty("tvl_pre_depeg_usd") Double tvlPreDepegUsd;
    @JsonProperty("estimated_loss_usd") Double estimatedLossUsd;

    public static SharePriceImpactRow from(SharePriceImpact i) {
        return SharePriceImpactRow.builder()
                .chainId(i.getVaultKey().chainId())
                .chain(i.getChainName())
                .vaultAddress(i.getVaultKey().address())
                .vaultName(i.getVaultName())
                .curator(i.getCuratorIdentity())
                .exposureStatus(i.getExposureStatus() == null ? null : i.getExposureStatus().name())
                .collateralSymbols(String.join("|", i.getCollateralSymbols()))
                .dailyPoints(i.getDailyPoints())
                .peakSharePrice(i.getPeakSharePrice())
                .peakTs(i.getPeakTs())
                .troughSharePrice(i.getTroughSharePrice())
                .troughTs(i.getTroughTs())
                .maxDrawdown(i.getMaxDrawdown())
                .latestSharePrice(i.getLatestSharePrice())
                .latestTs(i.getLatestTs())
                .recovery(i.getRecovery())
                .depegWindowDrop(i.getDepegWindowDrop())
                .tvlAtPeakUsd(i.getTvlAtPeakUsd())
                .tvlAtTroughUsd(i.getTvlAtTroughUsd())
                .tvlPreDepegUsd(i.getTvlPreDepegUsd())
                .estimatedLossUsd(i.getEstimatedLossUsd())
                .build();
    }
}
