package com.depegscan.report;

import com.depegscan.model.BadDebtAssessment;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"chain_id", "chain", "market_key", "collateral_symbol", "loan_symbol", "supply_usd", "borrow_usd",
        "collateral_usd", "utilization", "gap_raw", "gap_usd", "l1_loss_usd", "l1_loss_pct", "liquidity_discrepancy_raw",
        "bad_debt_usd", "realized_bad_debt_usd", "l2_total_usd", "oracle_implied_price_usd", "collateral_spot_usd",
        "oracle_deviation", "mispricing_exposure_usd", "true_ltv", "displayed_ltv", "lltv", "oracle_type",
        "oracle_hardcoded", "oracle_vault_based", "status", "oracle_masking", "best_estimate_usd"})
public class BadDebtRow {
    @JsonProperty("chain_id") long chainId;
    @JsonProperty("chain") String chain;
    @JsonProperty("market_key") String marketKey;
    @JsonProperty("collateral_symbol") String collateralSymbol;
    @JsonProperty("loan_symbol") String loanSymbol;
    @JsonProperty("supply_usd") double supplyUsd;
    @JsonProperty("borrow_usd") double borrowUsd;
    @JsonProperty("collateral_usd") double collateralUsd;
    @JsonProperty("utilization") double utilization;
    @JsonProperty("gap_raw") String gapRaw;
    @JsonProperty("gap_usd") double gapUsd;
    @JsonProperty("l1_loss_usd") double l1LossUsd;
    @JsonProperty("l1_loss_pct") double l1LossPct;
    @JsonProperty("liquidity_discrepancy_raw") String liquidityDiscrepancyRaw;
    @JsonProperty("bad_debt_usd") double badDebtUsd;
    @JsonProperty("realized_bad_debt_usd") double realizedBadDebtUsd;
    @JsonProperty("l2_total_usd") double l2TotalUsd;
    @JsonProperty("oracle_implied_price_usd") Double oracleImpliedPriceUsd;
    @JsonProperty("collateral_spot_usd") Double collateralSpotUsd;
    @JsonProperty("oracle_deviation") Double oracleDeviation;
    @JsonProperty("mispricing_exposure_usd") Double mispricingExposureUsd;
    @JsonProperty("true_ltv") Double trueLtv;
    @JsonProperty("displayed_ltv") Double displayedLtv;
    @JsonProperty("lltv") double lltv;
    @JsonProperty("oracle_type") String oracleType;
    @JsonProperty("oracle_hardcoded") boolean oracleHardcoded;
    @JsonProperty("oracle_vault_based") boolean oracleVaultBased;
    @JsonProperty("status") String status;
    @JsonProperty("oracle_masking") boolean oracleMasking;
    @JsonProperty("best_estimate_usd") double bestEstimateUsd;

    public static BadDebtRow from(BadDebtAssessment a) {
        return BadDebtRow.builder()
                .chainId(a.getMarketKey().chainId())
                .chain(a.getChainName())
                .marketKey(a.getMarketKey().uniqueKey())
                .collateralSymbol(a.getCollateralSymbol())
                .loanSymbol(a.getLoanSymbol())
                .supplyUsd(a.getSupplyUsd())
                .borrowUsd(a.getBorrowUsd())
                .collateralUsd(a.getCollateralUsd())
                .utilization(a.getUtilization())
                .gapRaw(String.valueOf(a.getGapRaw()))
                .gapUsd(a.getGapUsd())
                .l1LossUsd(a.getLayer1LossUsd())
                .l1LossPct(a.getLayer1LossPctOfSupply())
                .liquidityDiscrepancyRaw(String.valueOf(a.getLiquidityDiscrepancyRaw()))
                .badDebtUsd(a.getBadDebtUsd())
                .realizedBadDebtUsd(a.getRealizedBadDebtUsd())
                .l2TotalUsd(a.getLayer2TotalUsd())
                .oracleImpliedPriceUsd(a.getOracleImpliedPriceUsd())
                .collateralSpotUsd(a.getCollateralSpotUsd())
                .oracleDeviation(a.getOracleDeviation())
                .mispricingExposureUsd(a.getMispricingExposureUsd())
                .trueLtv(a.getTrueLtv())
                .displayedLtv(a.getDisplayedLtv())
                .lltv(a.getLltv())
                .oracleType(a.getOracleType())
                .oracleHardcoded(a.isOracleHardcoded())
                .oracleVaultBased(a.isOracleVaultBased())
                .status(a.getStatus().name())
                .oracleMasking(a.isOracleMasking())
                .bestEstimateUsd(a.getBestEstimateUsd())
                .build();
    }
}
