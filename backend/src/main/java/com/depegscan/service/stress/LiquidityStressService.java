package com.depegscan.service.stress;

import com.depegscan.client.LendingApiClient;
import com.depegscan.config.CrisisTimeline;
import com.depegscan.model.Market;
import com.depegscan.model.MarketStressProfile;
import com.depegscan.model.SeriesPoint;
import com.depegscan.normalize.EntityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class LiquidityStressService {

    private final LendingApiClient client;
    private final EntityNormalizer normalizer;
    private final LiquidityStressAnalyzer analyzer;
    private final CrisisTimeline timeline;

    public List<MarketStressProfile> analyze(List<Market> toxicMarkets) {
        List<MarketStressProfile> out = new ArrayList<>();
        for (Market m : toxicMarkets) {
            try {
                List<SeriesPoint> series = client.fetchMarketUtilizationHistory(m.getKey().uniqueKey(), m.getKey().chainId(),
                                timeline.windowStartInstant(), timeline.windowEndInstant())
                        .map(normalizer::toUtilizationSeries)
                        .orElse(List.of());
                out.add(analyzer.analyze(m, series));
            } catch (Exception ex) {
                log.warn("[stress] market={} failed: {}", m.getKey(), ex.getMessage());
            }
        }
        log.info("[stress] {} market utilization profiles", out.size());
        return out;
    }
}
