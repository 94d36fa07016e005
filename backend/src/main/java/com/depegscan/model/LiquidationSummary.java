package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

/**
 * Liquidation activity and borrower concentration of one toxic market. A market with borrowers
 * but no liquidation events kept its positions healthy on paper, usually because its oracle
 * never repriced the collateral.
 */
@Value
@Builder
public class LiquidationSummary {
    MarketKey marketKey;
    String chainName;
    String collateralSymbol;
    String loanSymbol;
    int liquidationCount;
    int liquidationsAfterCrisis;
    int distinctLiquidators;
    double seizedUsd;
    double repaidUsd;
    double badDebtUsd;
    Long firstLiquidationTs;
    Long lastLiquidationTs;
    int borrowers;
    double totalBorrowUsd;
    String topBorrower;
    /** Share of total borrow held by the largest borrower, 0..1. */
    double topBorrowerShare;
    /** Borrowers whose health factor is below 1. */
    int unhealthyBorrowers;
}
