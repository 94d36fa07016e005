package com.depegscan.service.curator;

import com.depegscan.client.LendingApiClient;
import com.depegscan.client.dto.AdminEventDto;
import com.depegscan.client.dto.ReallocationDto;
import com.depegscan.config.CrisisTimeline;
import com.depegscan.model.AdminEvent;
import com.depegscan.model.AllocationPoint;
import com.depegscan.model.CuratorResponseProfile;
import com.depegscan.model.Exposure;
import com.depegscan.model.ExposureStatus;
import com.depegscan.model.Market;
import com.depegscan.model.MarketKey;
import com.depegscan.model.ReallocationEvent;
import com.depegscan.model.ResponseClass;
import com.depegscan.model.VaultEventHistory;
import com.depegscan.model.VaultKey;
import com.depegscan.normalize.EntityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Collects allocation history, admin events and reallocations for every exposed vault and
 * classifies the curator's response. A stream that cannot be fetched is treated as empty.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CuratorResponseService {

    private final LendingApiClient client;
    private final EntityNormalizer normalizer;
    private final CuratorResponseClassifier classifier;
    private final CrisisTimeline timeline;

    public List<CuratorResponseProfile> reconstruct(List<Exposure> exposures, List<Market> toxicMarkets) {
        Set<MarketKey> toxicKeys = new HashSet<>();
        toxicMarkets.forEach(m -> toxicKeys.add(m.getKey()));
        exposures.forEach(e -> toxicKeys.add(e.getMarketKey()));

        Map<VaultKey, List<Exposure>> byVault = exposures.stream()
                .collect(Collectors.groupingBy(Exposure::getVaultKey, TreeMap::new, Collectors.toList()));
        Map<Long, List<VaultKey>> byChain = byVault.keySet().stream()
                .collect(Collectors.groupingBy(VaultKey::chainId, TreeMap::new, Collectors.toList()));

        Map<VaultKey, List<ReallocationEvent>> reallocations = new HashMap<>();
        byChain.forEach((chainId, vaults) -> reallocations.putAll(fetchReallocations(chainId, vaults)));

        List<CuratorResponseProfile> out = new ArrayList<>();
        for (Map.Entry<VaultKey, List<Exposure>> e : byVault.entrySet()) {
            VaultKey vk = e.getKey();
            try {
                VaultEventHistory history = new VaultEventHistory(vk,
                        fetchAllocations(vk),
                        fetchAdminEvents(vk),
                        reallocations.getOrDefault(vk, List.of()));
                Exposure first = e.getValue().get(0);
                CuratorResponseProfile profile = classifier.classify(history, toxicKeys, mostExposed(e.getValue()))
                        .toBuilder()
                        .vaultName(first.getVaultName())
                        .curatorIdentity(first.getCuratorIdentity())
                        .chainName(first.getChainName())
                        .build();
                out.add(profile);
            } catch (Exception ex) {
                log.error("[curator] vault={} failed: {}", vk, ex.getMessage());
            }
        }
        Map<ResponseClass, Long> histogram = out.stream()
                .collect(Collectors.groupingBy(CuratorResponseProfile::getResponseClass, TreeMap::new, Collectors.counting()));
        log.info("[curator] {} vault profiles: {}", out.size(), histogram);
        return out;
    }

    /**
     * ACTIVE_EXPOSURE on any row wins; otherwise the status of the largest row.
     */
    static ExposureStatus mostExposed(List<Exposure> rows) {
        if (rows.isEmpty()) return null;
        if (rows.stream().anyMatch(r -> r.getExposureStatus() == ExposureStatus.ACTIVE_EXPOSURE)) {
            return ExposureStatus.ACTIVE_EXPOSURE;
        }
        return rows.get(0).getExposureStatus();
    }

    private Map<VaultKey, List<ReallocationEvent>> fetchReallocations(long chainId, List<VaultKey> vaults) {
        Map<VaultKey, List<ReallocationEvent>> grouped = new HashMap<>();
        try {
            List<String> addresses = vaults.stream().map(VaultKey::address).toList();
            List<ReallocationDto> raw = client.fetchReallocationsByVaults(chainId, addresses,
                    timeline.windowStartInstant(), timeline.windowEndInstant());
            for (ReallocationDto dto : raw) {
                try {
                    ReallocationEvent r = normalizer.toReallocation(dto, chainId);
                    grouped.computeIfAbsent(r.getVaultKey(), k -> new ArrayList<>()).add(r);
                } catch (IllegalArgumentException ex) {
                    log.warn("[curator] skip reallocation {}: {}", dto.getId(), ex.getMessage());
                }
            }
        } catch (Exception ex) {
            log.error("[curator] reallocations chainId={} failed, stream treated as empty: {}", chainId, ex.getMessage());
        }
        return grouped;
    }

    private List<AllocationPoint> fetchAllocations(VaultKey vk) {
        try {
            return client.fetchVaultAllocationHistory(vk.address(), vk.chainId(),
                            timeline.windowStartInstant(), timeline.windowEndInstant())
                    .map(dto -> normalizer.toAllocationPoints(dto, vk.chainId()))
                    .orElse(List.of());
        } catch (Exception ex) {
            log.warn("[curator] allocation history vault={} unavailable: {}", vk, ex.getMessage());
            return List.of();
        }
    }

    private List<AdminEvent> fetchAdminEvents(VaultKey vk) {
        List<AdminEvent> out = new ArrayList<>();
        try {
            for (AdminEventDto dto : client.fetchVaultAdminEvents(vk.address(), vk.chainId())) {
                try {
                    out.add(normalizer.toAdminEvent(dto, vk.chainId()));
                } catch (IllegalArgumentException ex) {
                    log.warn("[curator] skip admin event {} vault={}: {}", dto.getHash(), vk, ex.getMessage());
                }
            }
        } catch (Exception ex) {
            log.warn("[curator] admin events vault={} unavailable: {}", vk, ex.getMessage());
        }
        return out;
    }
}
