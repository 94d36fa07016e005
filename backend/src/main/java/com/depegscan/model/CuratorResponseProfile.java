package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class CuratorResponseProfile {
    VaultKey vaultKey;
    String vaultName;
    String curatorIdentity;
    String chainName;
    ExposureStatus exposureStatus;

    double peakToxicAllocationUsd;
    Long peakTimestamp;
    Double allocationAtCrisisUsd;
    Double allocationWeekBeforeUsd;

    Long firstZeroAllocationTs;
    Long firstCapZeroTs;
    Long firstToxicWithdrawTs;
    Long lastToxicWithdrawTs;
    int toxicWithdrawCount;
    int toxicSupplyCount;
    Long queueRemovalTs;
    int adminEventCount;

    Long earliestActionTs;
    ActionSource earliestActionSource;
    Double daysBeforeCrisis;
    ResponseClass responseClass;
}
