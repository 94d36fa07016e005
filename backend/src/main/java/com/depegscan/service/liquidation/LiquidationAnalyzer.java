package com.depegscan.service.liquidation;

import com.depegscan.config.CrisisTimeline;
import com.depegscan.model.BorrowerPosition;
import com.depegscan.model.LiquidationEvent;
import com.depegscan.model.LiquidationSummary;
import com.depegscan.model.Market;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds a market's liquidation transactions and open positions into one summary.
 */
public class LiquidationAnalyzer {

    private final CrisisTimeline timeline;

    public LiquidationAnalyzer(CrisisTimeline timeline) {
        this.timeline = timeline;
    }

    /**
     * @param events liquidations of this market, any order
     * @param positions current positions of this market, any order
     */
    public LiquidationSummary summarize(Market market, List<LiquidationEvent> events, List<BorrowerPosition> positions) {
        double seized = 0.0;
        double repaid = 0.0;
        double badDebt = 0.0;
        int afterCrisis = 0;
        Long firstTs = null;
        Long lastTs = null;
        Set<String> liquidators = new HashSet<>();
        for (LiquidationEvent e : events) {
            seized += e.getSeizedUsd();
            repaid += e.getRepaidUsd();
            badDebt += e.getBadDebtUsd();
            if (e.getTimestamp() >= timeline.crisis()) afterCrisis++;
            if (firstTs == null || e.getTimestamp() < firstTs) firstTs = e.getTimestamp();
            if (lastTs == null || e.getTimestamp() > lastTs) lastTs = e.getTimestamp();
            if (e.getLiquidator() != null) liquidators.add(e.getLiquidator());
        }

        // one borrower may show up once per page overlap; merge by address
        Map<String, Double> borrowByUser = new HashMap<>();
        Set<String> unhealthy = new HashSet<>();
        for (BorrowerPosition p : positions) {
            if (p.getBorrowUsd() <= 0) continue;
            borrowByUser.merge(p.getBorrower(), p.getBorrowUsd(), Math::max);
            if (p.getHealthFactor() != null && p.getHealthFactor() < 1.0) unhealthy.add(p.getBorrower());
        }
        double totalBorrow = borrowByUser.values().stream().mapToDouble(Double::doubleValue).sum();
        String top = null;
        double topBorrow = 0.0;
        for (Map.Entry<String, Double> b : borrowByUser.entrySet()) {
            if (top == null || b.getValue() > topBorrow || (b.getValue() == topBorrow && b.getKey().compareTo(top) < 0)) {
                top = b.getKey();
                topBorrow = b.getValue();
            }
        }

        return LiquidationSummary.builder()
                .marketKey(market.getKey())
                .chainName(market.getChainName())
                .collateralSymbol(market.collateralSymbol())
                .loanSymbol(market.loanSymbol())
                .liquidationCount(events.size())
                .liquidationsAfterCrisis(afterCrisis)
                .distinctLiquidators(liquidators.size())
                .seizedUsd(seized)
                .repaidUsd(repaid)
                .badDebtUsd(badDebt)
                .firstLiquidationTs(firstTs)
                .lastLiquidationTs(lastTs)
                .borrowers(borrowByUser.size())
                .totalBorrowUsd(totalBorrow)
                .topBorrower(top)
                .topBorrowerShare(totalBorrow > 0 ? topBorrow / totalBorrow : 0.0)
                .unhealthyBorrowers(unhealthy.size())
                .build();
    }
}
