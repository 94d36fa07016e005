package com.depegscan.service.discovery;

import com.depegscan.model.MarketKey;
import com.depegscan.model.VaultKey;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Vaults seen in the historical reallocation log, each with the toxic markets it actually
 * touched. A vault may be present with an empty market set when the log entry could not be
 * attributed to a toxic market.
 */
public class HistoricalTouches {

    private final Map<VaultKey, SortedSet<MarketKey>> touches = new TreeMap<>();

    /**
     * @param market toxic market the vault touched, or null when the log entry named none
     */
    public synchronized void record(VaultKey vault, MarketKey market) {
        SortedSet<MarketKey> markets = touches.computeIfAbsent(vault, k -> new TreeSet<>());
        if (market != null) markets.add(market);
    }

    public synchronized Set<VaultKey> vaults() {
        return Collections.unmodifiableSet(new TreeSet<>(touches.keySet()));
    }

    public synchronized SortedSet<MarketKey> marketsOf(VaultKey vault) {
        SortedSet<MarketKey> m = touches.get(vault);
        return m == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(new TreeSet<>(m));
    }

    public synchronized int size() {
        return touches.size();
    }
}
