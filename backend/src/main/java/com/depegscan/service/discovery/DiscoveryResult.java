package com.depegscan.service.discovery;

import com.depegscan.model.Exposure;

import java.util.List;

/**
 * Outcome of the three discovery phases.
 *
 * @param exposures deduplicated exposure rows
 * @param currentAllocationVaults vaults stored by phase 1
 * @param historicalVaults distinct vaults seen in the reallocation log
 * @param backfilledVaults vaults added by phase 3
 * @param backfillMisses phase 3 lookups that returned nothing
 */
public record DiscoveryResult(List<Exposure> exposures,
                              int currentAllocationVaults,
                              int historicalVaults,
                              int backfilledVaults,
                              int backfillMisses) {
}
