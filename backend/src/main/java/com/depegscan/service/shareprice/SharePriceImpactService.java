package com.depegscan.service.shareprice;

import com.depegscan.client.LendingApiClient;
import com.depegscan.client.dto.VaultSharePriceHistoryDto;
import com.depegscan.config.CrisisTimeline;
import com.depegscan.model.Exposure;
import com.depegscan.model.SeriesPoint;
import com.depegscan.model.SharePriceImpact;
import com.depegscan.model.VaultKey;
import com.depegscan.normalize.EntityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class SharePriceImpactService {

    private final LendingApiClient client;
    private final EntityNormalizer normalizer;
    private final SharePriceImpactAnalyzer analyzer;
    private final CrisisTimeline timeline;

    /**
     * One impact row per exposed vault with at least two daily prices, worst drawdown first.
     */
    public List<SharePriceImpact> analyze(List<Exposure> exposures) {
        Map<VaultKey, List<Exposure>> byVault = new LinkedHashMap<>();
        for (Exposure e : exposures) {
            byVault.computeIfAbsent(e.getVaultKey(), k -> new ArrayList<>()).add(e);
        }
        List<SharePriceImpact> out = new ArrayList<>();
        int tooShort = 0;
        for (Map.Entry<VaultKey, List<Exposure>> entry : byVault.entrySet()) {
            VaultKey vk = entry.getKey();
            try {
                Optional<VaultSharePriceHistoryDto> history = client.fetchVaultSharePriceHistory(vk.address(), vk.chainId(),
                        timeline.windowStartInstant(), timeline.windowEndInstant());
                List<SeriesPoint> prices = history.map(normalizer::toSharePriceSeries).orElse(List.of());
                List<SeriesPoint> tvl = history.map(normalizer::toTotalAssetsSeries).orElse(List.of());
                Optional<SharePriceImpact> impact = analyzer.analyze(entry.getValue(), prices, tvl);
                if (impact.isPresent()) {
                    out.add(impact.get());
                } else {
                    tooShort++;
                }
            } catch (Exception ex) {
                log.warn("[share-price] vault={} failed: {}", vk, ex.getMessage());
            }
        }
        out.sort(Comparator.comparingDouble(SharePriceImpact::getMaxDrawdown).reversed()
                .thenComparing(SharePriceImpact::getVaultKey));
        log.info("[share-price] {} vault impacts, {} vaults without enough price history", out.size(), tooShort);
        return out;
    }
}
