package com.depegscan.report;

import com.depegscan.model.MultiMarketExposure;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"chain_id", "chain", "vault_address", "vault_name", "curator", "vault_total_assets_usd",
        "toxic_market_count", "collateral_symbols", "total_toxic_supply_usd", "combined_exposure_pct",
        "active_exposures"})
public class MultiMarketVaultRow {
    @JsonProperty("chain_id") long chainId;
    @JsonProperty("chain") String chain;
    @JsonProperty("vault_address") String vaultAddress;
    @JsonProperty("vault_name") String vaultName;
    @JsonProperty("curator") String curator;
    @JsonProperty("vault_total_assets_usd") double vaultTotalAssetsUsd;
    @JsonProperty("toxic_market_count") int toxicMarketCount;
    @JsonProperty("collateral_symbols") String collateralSymbols;
    @JsonProperty("total_toxic_supply_usd") double totalToxicSupplyUsd;
    @JsonProperty("combined_exposure_pct") double combinedExposurePct;
    @JsonProperty("active_exposures") int activeExposures;

    public static MultiMarketVaultRow from(MultiMarketExposure m) {
        return MultiMarketVaultRow.builder()
                .chainId(m.getVaultKey().chainId())
                .chain(m.getChainName())
                .vaultAddress(m.getVaultKey().address())
                .vaultName(m.getVaultName())
                .curator(m.getCuratorIdentity())
                .vaultTotalAssetsUsd(m.getVaultTotalAssetsUsd())
                .toxicMarketCount(m.getToxicMarketCount())
                .collateralSymbols(String.join("|", m.getCollateralSymbols()))
                .totalToxicSupplyUsd(m.getTotalToxicSupplyUsd())
                .combinedExposurePct(m.getCombinedExposurePct())
                .activeExposures(m.getActiveExposures())
                .build();
    }
}
