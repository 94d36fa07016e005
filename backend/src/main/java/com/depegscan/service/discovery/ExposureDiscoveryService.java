package com.depegscan.service.discovery;

import com.depegscan.client.LendingApiClient;
import com.depegscan.client.dto.ReallocationDto;
import com.depegscan.client.dto.VaultDto;
import com.depegscan.model.DiscoveryMethod;
import com.depegscan.model.Exposure;
import com.depegscan.model.Market;
import com.depegscan.model.MarketKey;
import com.depegscan.model.Vault;
import com.depegscan.model.VaultKey;
import com.depegscan.model.VaultRecord;
import com.depegscan.normalize.EntityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Finds every vault exposed to the toxic markets, in three ordered phases:
 * <ol>
 *   <li>vaults whose live allocation includes a toxic market;</li>
 *   <li>vaults that ever reallocated into or out of a toxic market;</li>
 *   <li>individual lookup of phase 2 vaults that phase 1 did not return.</li>
 * </ol>
 * Results accumulate in the caller's {@link VaultRecordStore}; the exposure rows are then
 * built by {@link ExposureReconciler}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExposureDiscoveryService {

    private final LendingApiClient client;
    private final EntityNormalizer normalizer;
    private final ExposureReconciler reconciler;

    public DiscoveryResult discover(List<Market> toxicMarkets, VaultRecordStore store) {
        Map<Long, List<Market>> byChain = toxicMarkets.stream()
                .collect(Collectors.groupingBy(m -> m.getKey().chainId(), TreeMap::new, Collectors.toList()));

        int phase1 = collectCurrentAllocations(byChain, store);
        log.info("[discovery] phase1 current allocations: {} vaults", phase1);

        HistoricalTouches touches = collectHistoricalTouches(byChain);
        log.info("[discovery] phase2 reallocation log: {} vaults", touches.size());

        int[] backfill = backfillMissing(touches, store);
        log.info("[discovery] phase3 backfill: {} added, {} not found", backfill[0], backfill[1]);

        List<Exposure> exposures = reconciler.reconcile(store.all(), toxicMarkets, touches);
        log.info("[discovery] reconciled {} exposure rows over {} vaults", exposures.size(),
                exposures.stream().map(Exposure::getVaultKey).distinct().count());
        return new DiscoveryResult(exposures, phase1, touches.size(), backfill[0], backfill[1]);
    }

    int collectCurrentAllocations(Map<Long, List<Market>> byChain, VaultRecordStore store) {
        int stored = 0;
        for (Map.Entry<Long, List<Market>> e : byChain.entrySet()) {
            long chainId = e.getKey();
            try {
                List<VaultDto> vaults = client.fetchVaultsByMarkets(chainId, uniqueKeys(e.getValue()));
                for (VaultDto dto : vaults) {
                    try {
                        Vault vault = normalizer.toVault(dto, chainId);
                        if (store.putIfAbsent(new VaultRecord(vault, DiscoveryMethod.CURRENT_ALLOCATION))) {
                            stored++;
                        }
                    } catch (Exception ex) {
                        log.warn("[discovery] phase1 skip vault {} chainId={}: {}", dto.getAddress(), chainId, ex.getMessage());
                    }
                }
            } catch (Exception ex) {
                log.error("[discovery] phase1 chainId={} failed: {}", chainId, ex.getMessage());
            }
        }
        return stored;
    }

    HistoricalTouches collectHistoricalTouches(Map<Long, List<Market>> byChain) {
        HistoricalTouches touches = new HistoricalTouches();
        for (Map.Entry<Long, List<Market>> e : byChain.entrySet()) {
            long chainId = e.getKey();
            Set<MarketKey> toxicKeys = e.getValue().stream().map(Market::getKey).collect(Collectors.toSet());
            try {
                List<ReallocationDto> reallocations = client.fetchReallocationsByMarkets(chainId, uniqueKeys(e.getValue()));
                for (ReallocationDto r : reallocations) {
                    if (r.getVault() == null || r.getVault().getAddress() == null) continue;
                    try {
                        VaultKey vk = VaultKey.of(r.getVault().getAddress(), chainId);
                        MarketKey mk = (r.getMarket() == null || r.getMarket().getUniqueKey() == null)
                                ? null : MarketKey.of(r.getMarket().getUniqueKey(), chainId);
                        touches.record(vk, mk != null && toxicKeys.contains(mk) ? mk : null);
                    } catch (IllegalArgumentException ex) {
                        log.warn("[discovery] phase2 skip reallocation {}: {}", r.getId(), ex.getMessage());
                    }
                }
            } catch (Exception ex) {
                log.error("[discovery] phase2 chainId={} failed: {}", chainId, ex.getMessage());
            }
        }
        return touches;
    }

    /**
     * @return {added, notFound}
     */
    int[] backfillMissing(HistoricalTouches touches, VaultRecordStore store) {
        int added = 0;
        int missing = 0;
        for (VaultKey vk : touches.vaults()) {
            if (store.contains(vk)) continue;
            try {
                Optional<VaultDto> dto = client.fetchVault(vk.address(), vk.chainId());
                if (dto.isEmpty()) {
                    missing++;
                    log.warn("[discovery] phase3 vault={} not returned by API, keeping historical rows only", vk);
                    continue;
                }
                Vault vault = normalizer.toVault(dto.get(), vk.chainId());
                if (store.putIfAbsent(new VaultRecord(vault, DiscoveryMethod.INDIVIDUAL_BACKFILL))) {
                    added++;
                }
            } catch (Exception ex) {
                missing++;
                log.warn("[discovery] phase3 vault={} failed: {}", vk, ex.getMessage());
            }
        }
        return new int[]{added, missing};
    }

    private static List<String> uniqueKeys(List<Market> markets) {
        return markets.stream().map(m -> m.getKey().uniqueKey()).distinct().toList();
    }
}
