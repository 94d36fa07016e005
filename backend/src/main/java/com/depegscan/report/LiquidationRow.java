package com.depegscan.report;

import com.depegscan.model.LiquidationSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"chain_id", "chain", "market_key", "collateral_symbol", "loan_symbol", "liquidation_count",
        "liquidations_after_crisis", "distinct_liquidators", "seized_usd", "repaid_usd", "bad_debt_usd",
        "first_liquidation_ts", "last_liquidation_ts", "borrowers", "total_borrow_usd", "top_borrower",
        "top_borrower_share", "unhealthy_borrowers"})
public class LiquidationRow {
    @JsonProperty("chain_id") long chainId;
    @JsonProperty("chain") String chain;
    @JsonProperty("market_key") String marketKey;
    @JsonProperty("collateral_symbol") String collateralSymbol;
    @JsonProperty("loan_symbol") String loanSymbol;
    @JsonProperty("liquidation_count") int liquidationCount;
    @JsonProperty("liquidations_after_crisis") int liquidationsAfterCrisis;
    @JsonProperty("distinct_liquidators") int distinctLiquidators;
    @JsonProperty("seized_usd") double seizedUsd;
    @JsonProperty("repaid_usd") double repaidUsd;
    @JsonProperty("bad_debt_usd") double badDebtUsd;
    @JsonProperty("first_liquidation_ts") Long firstLiquidationTs;
    @JsonProperty("last_liquidation_ts") Long lastLiquidationTs;
    @JsonProperty("borrowers") int borrowers;
    @JsonProperty("total_borrow_usd") double totalBorrowUsd;
    @JsonProperty("top_borrower") String topBorrower;
    @JsonProperty("top_borrower_share") double topBorrowerShare;
    @JsonProperty("unhealthy_borrowers") int unhealthyBorrowers;

    public static LiquidationRow from(LiquidationSummary s) {
        return LiquidationRow.builder()
                .chainId(s.getMarketKey().chainId())
                .chain(s.getChainName())
                .marketKey(s.getMarketKey().uniqueKey())
                .collateralSymbol(s.getCollateralSymbol())
                .loanSymbol(s.getLoanSymbol())
                .liquidationCount(s.getLiquidationCount())
                .liquidationsAfterCrisis(s.getLiquidationsAfterCrisis())
                .distinctLiquidators(s.getDistinctLiquidators())
                .seizedUsd(s.getSeizedUsd())
                .repaidUsd(s.getRepaidUsd())
                .badDebtUsd(s.getBadDebtUsd())
                .firstLiquidationTs(s.getFirstLiquidationTs())
                .lastLiquidationTs(s.getLastLiquidationTs())
                .borrowers(s.getBorrowers())
                .totalBorrowUsd(s.getTotalBorrowUsd())
                .topBorrower(s.getTopBorrower())
                .topBorrowerShare(s.getTopBorrowerShare())
                .unhealthyBorrowers(s.getUnhealthyBorrowers())
                .build();
    }
}
