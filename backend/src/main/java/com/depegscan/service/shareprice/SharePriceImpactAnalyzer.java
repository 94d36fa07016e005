package com.depegscan.service.shareprice;

import com.depegscan.config.CrisisTimeline;
import com.depegscan.model.Exposure;
import com.depegscan.model.SeriesPoint;
import com.depegscan.model.SharePriceImpact;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Measures a vault's share-price drawdown around the crisis from its daily series.
 *
 * <p>The peak is the highest price strictly before the crisis (latest on ties), the trough the
 * lowest price from the crisis on (earliest on ties). Without pre-crisis samples the first
 * sample is the peak; without post-crisis samples the overall minimum is the trough.
 */
public class SharePriceImpactAnalyzer {

    static final long DEPEG_WINDOW_LEAD = CrisisTimeline.DAY_SECONDS;
    static final long DEPEG_WINDOW_TAIL = 3 * CrisisTimeline.DAY_SECONDS;
    static final double MIN_LOSS_DRAWDOWN = 0.001;

    private final CrisisTimeline timeline;

    public SharePriceImpactAnalyzer(CrisisTimeline timeline) {
        this.timeline = timeline;
    }

    /**
     * @param exposures the vault's exposure rows, largest first; identity is read from the first
     * @param prices daily share prices ordered by timestamp
     * @param tvl daily TVL in USD ordered by timestamp; may be empty
     * @return empty when fewer than two prices are available
     */
    public Optional<SharePriceImpact> analyze(List<Exposure> exposures, List<SeriesPoint> prices, List<SeriesPoint> tvl) {
        if (exposures.isEmpty() || prices.size() < 2) {
            return Optional.empty();
        }
        long crisis = timeline.crisis();

        SeriesPoint peak = null;
        SeriesPoint trough = null;
        SeriesPoint overallMin = null;
        for (SeriesPoint p : prices) {
            if (p.timestamp() < crisis) {
                if (peak == null || p.value() >= peak.value()) peak = p;
            } else if (trough == null || p.value() < trough.value()) {
                trough = p;
            }
            if (overallMin == null || p.value() < overallMin.value()) overallMin = p;
        }
        if (peak == null) peak = prices.get(0);
        if (trough == null) trough = overallMin;

        double drawdown = peak.value() > 0 ? (peak.value() - trough.value()) / peak.value() : 0.0;
        SeriesPoint latest = prices.get(prices.size() - 1);
        double fall = peak.value() - trough.value();
        Double recovery = fall > 0 ? (latest.value() - trough.value()) / fall : null;

        Map<Long, Double> tvlByTs = new HashMap<>();
        for (SeriesPoint t : tvl) {
            tvlByTs.put(t.timestamp(), t.value());
        }
        Double tvlAtPeak = tvlByTs.get(peak.timestamp());
        Double tvlPreDepeg = tvlPreDepeg(tvl);
        Double base = tvlPreDepeg != null && tvlPreDepeg > 0 ? tvlPreDepeg : tvlAtPeak;
        Double loss = base != null && drawdown > MIN_LOSS_DRAWDOWN ? base * drawdown : null;

        Exposure first = exposures.get(0);
        return Optional.of(SharePriceImpact.builder()
                .vaultKey(first.getVaultKey())
                .vaultName(first.getVaultName())
                .curatorIdentity(first.getCuratorIdentity())
                .chainName(first.getChainName())
                .exposureStatus(first.getExposureStatus())
                .collateralSymbols(exposures.stream()
                        .map(Exposure::getCollateralSymbol)
                        .filter(s -> s != null && !s.isBlank())
                        .distinct()
                        .sorted()
                        .toList())
                .dailyPoints(prices.size())
                .peakSharePrice(peak.value())
                .peakTs(peak.timestamp())
                .troughSharePrice(trough.value())
                .troughTs(trough.timestamp())
                .maxDrawdown(drawdown)
                .latestSharePrice(latest.value())
                .latestTs(latest.timestamp())
                .recovery(recovery)
                .depegWindowDrop(depegWindowDrop(prices))
                .tvlAtPeakUsd(tvlAtPeak)
                .tvlAtTroughUsd(tvlByTs.get(trough.timestamp()))
                .tvlPreDepegUsd(tvlPreDepeg)
                .estimatedLossUsd(loss)
                .build());
    }

    private Double depegWindowDrop(List<SeriesPoint> prices) {
        long from = timeline.crisis() - DEPEG_WINDOW_LEAD;
        long to = timeline.crisis() + DEPEG_WINDOW_TAIL;
        SeriesPoint start = null;
        SeriesPoint end = null;
        for (SeriesPoint p : prices) {
            if (p.timestamp() < from || p.timestamp() > to) continue;
            if (start == null) start = p;
            end = p;
        }
        if (start == null || start.value() <= 0) return null;
        return (start.value() - end.value()) / start.value();
    }

    /** Latest TVL at or before the depeg window opens, else the earliest TVL. */
    private Double tvlPreDepeg(List<SeriesPoint> tvl) {
        if (tvl.isEmpty()) return null;
        long cutoff = timeline.crisis() - DEPEG_WINDOW_LEAD;
        Double pre = null;
        for (SeriesPoint t : tvl) {
            if (t.timestamp() <= cutoff) pre = t.value();
        }
        return pre != null ? pre : tvl.get(0).value();
    }
}
