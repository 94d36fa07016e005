package com.depegscan.service.discovery;

import com.depegscan.config.CrisisTimeline;
import com.depegscan.model.ExposureStatus;
import com.depegscan.model.VaultAllocation;

import java.math.BigInteger;

/**
 * Derives the exposure status of a live allocation from its cap, balance and pending removal.
 */
public class ExposureStatusResolver {

    private final CrisisTimeline timeline;

    public ExposureStatusResolver(CrisisTimeline timeline) {
        this.timeline = timeline;
    }

    public ExposureStatus resolve(VaultAllocation allocation) {
        return resolve(allocation.getSupplyCap(), allocation.getSupplyAssets(), allocation.getRemovableAt());
    }

    public ExposureStatus resolve(BigInteger supplyCap, BigInteger supplyAssets, Long removableAt) {
        if (isZero(supplyCap)) {
            if (removableAt != null && removableAt >= timeline.crisis()) {
                return ExposureStatus.WITHDREW_DURING_CRISIS;
            }
            if (removableAt != null && removableAt >= timeline.preCrisisStart()) {
                return ExposureStatus.WITHDREW_PRE_CRISIS;
            }
            return ExposureStatus.STOPPED_SUPPLYING;
        }
        if (isZero(supplyAssets)) {
            return ExposureStatus.FULLY_EXITED;
        }
        return ExposureStatus.ACTIVE_EXPOSURE;
    }

    private static boolean isZero(BigInteger v) {
        return v == null || v.signum() == 0;
    }
}
