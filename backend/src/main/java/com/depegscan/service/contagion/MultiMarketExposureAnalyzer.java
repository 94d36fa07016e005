package com.depegscan.service.contagion;

import com.depegscan.model.Exposure;
import com.depegscan.model.ExposureStatus;
import com.depegscan.model.MarketKey;
import com.depegscan.model.MultiMarketExposure;
import com.depegscan.model.VaultKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds vaults exposed to two or more distinct toxic markets, where one depeg hits the vault
 * through several lending positions at once.
 */
@Slf4j
public class MultiMarketExposureAnalyzer {

    private static final Comparator<MultiMarketExposure> ORDER =
            Comparator.comparingInt(MultiMarketExposure::getToxicMarketCount).reversed()
                    .thenComparing(Comparator.comparingDouble(MultiMarketExposure::getTotalToxicSupplyUsd).reversed())
                    .thenComparing(MultiMarketExposure::getVaultKey);

    public List<MultiMarketExposure> analyze(List<Exposure> exposures) {
        Map<VaultKey, List<Exposure>> byVault = new LinkedHashMap<>();
        for (Exposure e : exposures) {
            byVault.computeIfAbsent(e.getVaultKey(), k -> new ArrayList<>()).add(e);
        }
        List<MultiMarketExposure> out = new ArrayList<>();
        for (List<Exposure> rows : byVault.values()) {
            Set<MarketKey> markets = new HashSet<>();
            double supply = 0.0;
            double pct = 0.0;
            int active = 0;
            for (Exposure e : rows) {
                if (!markets.add(e.getMarketKey())) continue;
                supply += e.getSupplyUsd();
                pct += e.getExposurePct();
                if (e.getExposureStatus() == ExposureStatus.ACTIVE_EXPOSURE) active++;
            }
            if (markets.size() < 2) continue;
            Exposure first = rows.get(0);
            out.add(MultiMarketExposure.builder()
                    .vaultKey(first.getVaultKey())
                    .vaultName(first.getVaultName())
                    .curatorIdentity(first.getCuratorIdentity())
                    .chainName(first.getChainName())
                    .vaultTotalAssetsUsd(first.getVaultTotalAssetsUsd())
                    .toxicMarketCount(markets.size())
                    .collateralSymbols(rows.stream()
                            .map(Exposure::getCollateralSymbol)
                            .filter(s -> s != null && !s.isBlank())
                            .distinct()
                            .sorted()
                            .toList())
                    .totalToxicSupplyUsd(supply)
                    .combinedExposurePct(pct)
                    .activeExposures(active)
                    .build());
        }
        out.sort(ORDER);
        log.info("[contagion] {} vaults exposed to more than one toxic market", out.size());
        return out;
    }
}
