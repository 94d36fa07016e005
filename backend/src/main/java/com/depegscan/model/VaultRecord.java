package com.depegscan.model;

/**
 * A vault as accumulated during discovery, tagged with the phase that first stored it.
 */
public record VaultRecord(Vault vault, DiscoveryMethod source) {

    public VaultKey key() {
        return vault.getKey();
    }
}
