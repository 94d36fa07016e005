package com.depegscan.model;

import java.util.List;

/**
 * The three evidence streams of one vault. Each list is never null; an empty list means the
 * stream was unavailable or had no data, which is a valid input.
 */
public record VaultEventHistory(VaultKey vaultKey,
                                List<AllocationPoint> allocations,
                                List<AdminEvent> adminEvents,
                                List<ReallocationEvent> reallocations) {

    public VaultEventHistory {
        allocations = allocations == null ? List.of() : List.copyOf(allocations);
        adminEvents = adminEvents == null ? List.of() : List.copyOf(adminEvents);
        reallocations = reallocations == null ? List.of() : List.copyOf(reallocations);
    }

    public static VaultEventHistory empty(VaultKey vaultKey) {
        return new VaultEventHistory(vaultKey, List.of(), List.of(), List.of());
    }
}
