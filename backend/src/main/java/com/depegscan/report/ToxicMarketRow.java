package com.depegscan.report;

import com.depegscan.model.Market;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"chain_id", "chain", "market_key", "collateral_symbol", "loan_symbol", "lltv", "listed",
        "supply_usd", "borrow_usd", "collateral_usd", "utilization", "bad_debt_usd", "realized_bad_debt_usd", "warnings"})
public class ToxicMarketRow {
    @JsonProperty("chain_id") long chainId;
    @JsonProperty("chain") String chain;
    @JsonProperty("market_key") String marketKey;
    @JsonProperty("collateral_symbol") String collateralSymbol;
    @JsonProperty("loan_symbol") String loanSymbol;
    @JsonProperty("lltv") double lltv;
    @JsonProperty("listed") boolean listed;
    @JsonProperty("supply_usd") double supplyUsd;
    @JsonProperty("borrow_usd") double borrowUsd;
    @JsonProperty("collateral_usd") double collateralUsd;
    @JsonProperty("utilization") double utilization;
    @JsonProperty("bad_debt_usd") double badDebtUsd;
    @JsonProperty("realized_bad_debt_usd") double realizedBadDebtUsd;
    @JsonProperty("warnings") String warnings;

    public static ToxicMarketRow from(Market m) {
        return ToxicMarketRow.builder()
                .chainId(m.getKey().chainId())
                .chain(m.getChainName())
                .marketKey(m.getKey().uniqueKey())
                .collateralSymbol(m.collateralSymbol())
                .loanSymbol(m.loanSymbol())
                .lltv(m.getLltv())
                .listed(m.isListed())
                .supplyUsd(m.getState().getSupplyUsd())
                .borrowUsd(m.getState().getBorrowUsd())
                .collateralUsd(m.getState().getCollateralUsd())
                .utilization(m.getState().getUtilization())
                .badDebtUsd(m.getBadDebtUsd())
                .realizedBadDebtUsd(m.getRealizedBadDebtUsd())
                .warnings(m.getWarningTypes() == null ? "" : String.join("|", m.getWarningTypes()))
                .build();
    }
}
