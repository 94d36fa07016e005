package com.depegscan.service.liquidation;

import com.depegscan.client.LendingApiClient;
import com.depegscan.client.dto.LiquidationDto;
import com.depegscan.client.dto.MarketPositionDto;
import com.depegscan.model.BorrowerPosition;
import com.depegscan.model.LiquidationEvent;
import com.depegscan.model.LiquidationSummary;
import com.depegscan.model.Market;
import com.depegscan.model.MarketKey;
import com.depegscan.normalize.EntityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class LiquidationService {

    private final LendingApiClient client;
    private final EntityNormalizer normalizer;
    private final LiquidationAnalyzer analyzer;

    public List<LiquidationSummary> summarize(List<Market> toxicMarkets) {
        List<LiquidationSummary> out = new ArrayList<>();
        int silent = 0;
        for (Market m : toxicMarkets) {
            MarketKey key = m.getKey();
            try {
                List<String> keys = List.of(key.uniqueKey());
                List<LiquidationEvent> events = new ArrayList<>();
                for (LiquidationDto dto : client.fetchLiquidations(key.chainId(), keys)) {
                    try {
                        LiquidationEvent e = normalizer.toLiquidation(dto, key.chainId());
                        if (e.getMarketKey().equals(key)) events.add(e);
                    } catch (IllegalArgumentException ex) {
                        log.debug("[liquidations] skipping {}: {}", dto.getHash(), ex.getMessage());
                    }
                }
                List<BorrowerPosition> positions = new ArrayList<>();
                for (MarketPositionDto dto : client.fetchMarketPositions(key.chainId(), keys)) {
                    try {
                        positions.add(normalizer.toBorrowerPosition(dto, key.chainId()));
                    } catch (IllegalArgumentException ex) {
                        log.debug("[liquidations] skipping position in {}: {}", key, ex.getMessage());
                    }
                }
                LiquidationSummary summary = analyzer.summarize(m, events, positions);
                if (summary.getLiquidationCount() == 0 && summary.getBorrowers() > 0) silent++;
                out.add(summary);
            } catch (Exception ex) {
                log.warn("[liquidations] market={} failed: {}", key, ex.getMessage());
            }
        }
        log.info("[liquidations] {} market summaries, {} with borrowers but no liquidation", out.size(), silent);
        return out;
    }
}
