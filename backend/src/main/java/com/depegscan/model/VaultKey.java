package com.depegscan.model;

import com.depegscan.util.AddressUtil;

import java.util.Comparator;

/**
 * Canonical vault identity: lower-cased address plus chain id.
 */
public record VaultKey(String address, long chainId) implements Comparable<VaultKey> {

    private static final Comparator<VaultKey> ORDER =
            Comparator.comparingLong(VaultKey::chainId).thenComparing(VaultKey::address);

    public VaultKey {
        address = AddressUtil.canonical(address);
    }

    public static VaultKey of(String address, long chainId) {
        return new VaultKey(address, chainId);
    }

    @Override
    public int compareTo(VaultKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return address + "@" + chainId;
    }
}
