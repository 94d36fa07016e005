package com.depegscan.model;

import com.depegscan.util.AddressUtil;

import java.util.Comparator;

/**
 * Canonical market identity: lower-cased unique key plus chain id.
 */
public record MarketKey(String uniqueKey, long chainId) implements Comparable<MarketKey> {

    private static final Comparator<MarketKey> ORDER =
            Comparator.comparingLong(MarketKey::chainId).thenComparing(MarketKey::uniqueKey);

    public MarketKey {
        uniqueKey = AddressUtil.canonical(uniqueKey);
    }

    public static MarketKey of(String uniqueKey, long chainId) {
        return new MarketKey(uniqueKey, chainId);
    }

    @Override
    public int compareTo(MarketKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return uniqueKey + "@" + chainId;
    }
}
