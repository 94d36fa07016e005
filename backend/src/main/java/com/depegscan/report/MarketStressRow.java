package com.depegscan.report;

import com.depegscan.model.MarketStressProfile;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"chain_id", "chain", "market_key", "collateral_symbol", "samples", "peak_utilization",
        "peak_utilization_ts", "first_full_utilization_ts", "hours_at_full_utilization_after_crisis",
        "utilization_at_crisis"})
public class MarketStressRow {
    @JsonProperty("chain_id") long chainId;
    @JsonProperty("chain") String chain;
    @JsonProperty("market_key") String marketKey;
    @JsonProperty("collateral_symbol") String collateralSymbol;
    @JsonProperty("samples") int samples;
    @JsonProperty("peak_utilization") double peakUtilization;
    @JsonProperty("peak_utilization_ts") Long peakUtilizationTs;
    @JsonProperty("first_full_utilization_ts") Long firstFullUtilizationTs;
    @JsonProperty("hours_at_full_utilization_after_crisis") int hoursAtFullUtilizationAfterCrisis;
    @JsonProperty("utilization_at_crisis") Double utilizationAtCrisis;

    public static MarketStressRow from(MarketStressProfile p) {
        return MarketStressRow.builder()
                .chainId(p.getMarketKey().chainId())
                .chain(p.getChainName())
                .marketKey(p.getMarketKey().uniqueKey())
                .collateralSymbol(p.getCollateralSymbol())
                .samples(p.getSamples())
                .peakUtilization(p.getPeakUtilization())
                .peakUtilizationTs(p.getPeakUtilizationTs())
                .firstFullUtilizationTs(p.getFirstFullUtilizationTs())
                .hoursAtFullUtilizationAfterCrisis(p.getHoursAtFullUtilizationAfterCrisis())
                .utilizationAtCrisis(p.getUtilizationAtCrisis())
                .build();
    }
}
