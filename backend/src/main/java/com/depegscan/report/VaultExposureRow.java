package com.depegscan.report;

import com.depegscan.model.Exposure;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"chain_id", "chain", "vault_address", "vault_name", "curator", "vault_tvl_usd", "market_key",
        "collateral_symbol", "loan_symbol", "supply_assets", "supply_usd", "supply_cap", "supply_cap_usd",
        "exposure_pct", "removable_at", "discovery_method", "attribution_confidence", "exposure_status"})
public class VaultExposureRow {
    @JsonProperty("chain_id") long chainId;
    @JsonProperty("chain") String chain;
    @JsonProperty("vault_address") String vaultAddress;
    @JsonProperty("vault_name") String vaultName;
    @JsonProperty("curator") String curator;
    @JsonProperty("vault_tvl_usd") double vaultTvlUsd;
    @JsonProperty("market_key") String marketKey;
    @JsonProperty("collateral_symbol") String collateralSymbol;
    @JsonProperty("loan_symbol") String loanSymbol;
    @JsonProperty("supply_assets") String supplyAssets;
    @JsonProperty("supply_usd") double supplyUsd;
    @JsonProperty("supply_cap") String supplyCap;
    @JsonProperty("supply_cap_usd") double supplyCapUsd;
    @JsonProperty("exposure_pct") double exposurePct;
    @JsonProperty("removable_at") Long removableAt;
    @JsonProperty("discovery_method") String discoveryMethod;
    @JsonProperty("attribution_confidence") String attributionConfidence;
    @JsonProperty("exposure_status") String exposureStatus;

    public static VaultExposureRow from(Exposure e) {
        return VaultExposureRow.builder()
                .chainId(e.getVaultKey().chainId())
                .chain(e.getChainName())
                .vaultAddress(e.getVaultKey().address())
                .vaultName(e.getVaultName())
                .curator(e.getCuratorIdentity())
                .vaultTvlUsd(e.getVaultTotalAssetsUsd())
                .marketKey(e.getMarketKey().uniqueKey())
                .collateralSymbol(e.getCollateralSymbol())
                .loanSymbol(e.getLoanSymbol())
                .supplyAssets(String.valueOf(e.getSupplyAssets()))
                .supplyUsd(e.getSupplyUsd())
                .supplyCap(String.valueOf(e.getSupplyCap()))
                .supplyCapUsd(e.getSupplyCapUsd())
                .exposurePct(e.getExposurePct())
                .removableAt(e.getRemovableAt())
                .discoveryMethod(e.getDiscoveryMethod().label())
                .attributionConfidence(e.getAttributionConfidence().name())
                .exposureStatus(e.getExposureStatus().name())
                .build();
    }
}
