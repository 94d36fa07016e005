package com.depegscan.service.stress;

import com.depegscan.config.CrisisTimeline;
import com.depegscan.model.Market;
import com.depegscan.model.MarketStressProfile;
import com.depegscan.model.SeriesPoint;

import java.util.List;

/**
 * Summarizes a market's hourly utilization series around the crisis.
 */
public class LiquidityStressAnalyzer {

    private final CrisisTimeline timeline;
    private final double fullUtilization;

    public LiquidityStressAnalyzer(CrisisTimeline timeline, double fullUtilization) {
        this.timeline = timeline;
        this.fullUtilization = fullUtilization;
    }

    /**
     * @param utilization hourly samples ordered by timestamp; may be empty
     */
    public MarketStressProfile analyze(Market market, List<SeriesPoint> utilization) {
        double peak = 0.0;
        Long peakTs = null;
        Long firstFull = null;
        int hoursAtFull = 0;
        Double atCrisis = null;
        for (SeriesPoint p : utilization) {
            if (peakTs == null || p.value() > peak) {
                peak = p.value();
                peakTs = p.timestamp();
            }
            boolean full = p.value() >= fullUtilization;
            if (full && firstFull == null) {
                firstFull = p.timestamp();
            }
            if (p.timestamp() >= timeline.crisis()) {
                if (atCrisis == null) atCrisis = p.value();
                if (full) hoursAtFull++;
            }
        }
        return MarketStressProfile.builder()
                .marketKey(market.getKey())
                .chainName(market.getChainName())
                .collateralSymbol(market.collateralSymbol())
                .samples(utilization.size())
                .peakUtilization(peak)
                .peakUtilizationTs(peakTs)
                .firstFullUtilizationTs(firstFull)
                .hoursAtFullUtilizationAfterCrisis(hoursAtFull)
                .utilizationAtCrisis(atCrisis)
                .build();
    }
}
