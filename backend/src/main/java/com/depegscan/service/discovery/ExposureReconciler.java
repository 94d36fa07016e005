package com.depegscan.service.discovery;

import com.depegscan.model.AttributionConfidence;
import com.depegscan.model.DiscoveryMethod;
import com.depegscan.model.Exposure;
import com.depegscan.model.ExposureStatus;
import com.depegscan.model.Market;
import com.depegscan.model.MarketKey;
import com.depegscan.model.Vault;
import com.depegscan.model.VaultAllocation;
import com.depegscan.model.VaultKey;
import com.depegscan.model.VaultRecord;
import com.depegscan.util.NumberUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Merges live vault records and the historical reallocation log into one exposure row per
 * (vault, market). Vaults with a current toxic allocation get live rows only; the log adds
 * rows for vaults that no longer hold any toxic market. Pure: same inputs always give the same rows in the same order.
 */
@Slf4j
public class ExposureReconciler {

    private static final Comparator<Exposure> ORDER = Comparator
            .comparingDouble(Exposure::getSupplyUsd).reversed()
            .thenComparing(Exposure::getVaultKey)
            .thenComparing(Exposure::getMarketKey);

    private final ExposureStatusResolver statusResolver;
    private final ToxicSymbolFilter symbolFilter;

    public ExposureReconciler(ExposureStatusResolver statusResolver, ToxicSymbolFilter symbolFilter) {
        this.statusResolver = statusResolver;
        this.symbolFilter = symbolFilter;
    }

    private record PairKey(VaultKey vault, MarketKey market) {}

    public List<Exposure> reconcile(Collection<VaultRecord> records,
                                    Collection<Market> toxicMarkets,
                                    HistoricalTouches touches) {
        Map<MarketKey, Market> toxicByKey = new TreeMap<>();
        toxicMarkets.forEach(m -> toxicByKey.put(m.getKey(), m));

        Map<PairKey, Exposure> rows = new LinkedHashMap<>();
        Map<VaultKey, Vault> vaults = new HashMap<>();
        Set<VaultKey> withLiveRows = new HashSet<>();

        for (VaultRecord record : records) {
            Vault vault = record.vault();
            vaults.put(vault.getKey(), vault);
            for (VaultAllocation a : vault.getAllocations()) {
                if (!isToxicAllocation(a, toxicByKey)) continue;
                Exposure row = liveRow(vault, a, record.source());
                rows.merge(new PairKey(vault.getKey(), a.getMarketKey()), row, ExposureReconciler::prefer);
                withLiveRows.add(vault.getKey());
            }
        }

        for (VaultKey vk : touches.vaults()) {
            // historical rows only for vaults with no current toxic allocation
            if (withLiveRows.contains(vk)) continue;
            Vault vault = vaults.get(vk);
            SortedSet<MarketKey> touched = touches.marketsOf(vk);
            if (!touched.isEmpty()) {
                for (MarketKey mk : touched) {
                    Exposure row = historicalRow(vk, vault, mk, toxicByKey.get(mk), AttributionConfidence.CONFIRMED);
                    rows.merge(new PairKey(vk, mk), row, ExposureReconciler::prefer);
                }
                continue;
            }

            Optional<Market> fallback = toxicByKey.values().stream()
                    .filter(m -> m.getKey().chainId() == vk.chainId())
                    .findFirst();
            if (fallback.isEmpty()) {
                log.warn("[discovery] vault={} seen in reallocation log but no toxic market known on chain {}, dropped",
                        vk, vk.chainId());
                continue;
            }
            MarketKey mk = fallback.get().getKey();
            log.warn("[discovery] LOW-CONFIDENCE attribution vault={} -> market={} (no touched market recorded)", vk, mk);
            Exposure row = historicalRow(vk, vault, mk, fallback.get(), AttributionConfidence.LOW_CONFIDENCE_FALLBACK);
            rows.merge(new PairKey(vk, mk), row, ExposureReconciler::prefer);
        }

        List<Exposure> out = new ArrayList<>(rows.values());
        out.sort(ORDER);
        return out;
    }

    boolean isToxicAllocation(VaultAllocation a, Map<MarketKey, Market> toxicByKey) {
        return toxicByKey.containsKey(a.getMarketKey()) || symbolFilter.isToxic(a.getCollateralSymbol());
    }

    /**
     * Live rows beat historical rows; among historical rows a confirmed attribution beats a fallback.
     */
    static Exposure prefer(Exposure existing, Exposure candidate) {
        if (existing.getDiscoveryMethod().isLive()) return existing;
        if (candidate.getDiscoveryMethod().isLive()) return candidate;
        if (existing.getAttributionConfidence() == AttributionConfidence.LOW_CONFIDENCE_FALLBACK
                && candidate.getAttributionConfidence() == AttributionConfidence.CONFIRMED) {
            return candidate;
        }
        return existing;
    }

    private Exposure liveRow(Vault vault, VaultAllocation a, DiscoveryMethod source) {
        return Exposure.builder()
                .vaultKey(vault.getKey())
                .vaultName(vault.getName())
                .curatorIdentity(vault.getCuratorIdentity())
                .chainName(vault.getChainName())
                .vaultTotalAssetsUsd(vault.getTotalAssetsUsd())
                .marketKey(a.getMarketKey())
                .collateralSymbol(a.getCollateralSymbol())
                .loanSymbol(a.getLoanSymbol())
                .supplyAssets(a.getSupplyAssets())
                .supplyUsd(a.getSupplyAssetsUsd())
                .supplyCap(a.getSupplyCap())
                .supplyCapUsd(a.getSupplyCapUsd())
                .exposurePct(NumberUtil.safeDiv(a.getSupplyAssetsUsd(), vault.getTotalAssetsUsd()))
                .removableAt(a.getRemovableAt())
                .discoveryMethod(source)
                .attributionConfidence(AttributionConfidence.CONFIRMED)
                .exposureStatus(statusResolver.resolve(a))
                .build();
    }

    private static Exposure historicalRow(VaultKey vk, Vault vault, MarketKey mk, Market market,
                                          AttributionConfidence confidence) {
        return Exposure.builder()
                .vaultKey(vk)
                .vaultName(vault == null ? vk.address() : vault.getName())
                .curatorIdentity(vault == null ? null : vault.getCuratorIdentity())
                .chainName(vault == null ? (market == null ? null : market.getChainName()) : vault.getChainName())
                .vaultTotalAssetsUsd(vault == null ? 0.0 : vault.getTotalAssetsUsd())
                .marketKey(mk)
                .collateralSymbol(market == null ? null : market.collateralSymbol())
                .loanSymbol(market == null ? null : market.loanSymbol())
                .supplyAssets(BigInteger.ZERO)
                .supplyUsd(0.0)
                .supplyCap(BigInteger.ZERO)
                .supplyCapUsd(0.0)
                .exposurePct(0.0)
                .discoveryMethod(DiscoveryMethod.HISTORICAL_REALLOCATION)
                .attributionConfidence(confidence)
                .exposureStatus(ExposureStatus.HISTORICALLY_EXPOSED)
                .build();
    }
}
