package com.depegscan.report;

import com.depegscan.model.CuratorResponseProfile;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"chain_id", "chain", "vault_address", "vault_name", "curator", "exposure_status",
        "peak_toxic_alloc_usd", "peak_ts", "alloc_at_crisis_usd", "alloc_week_before_usd", "first_zero_alloc_ts",
        "first_cap_zero_ts", "first_toxic_withdraw_ts", "last_toxic_withdraw_ts", "toxic_withdraw_count",
        "toxic_supply_count", "queue_removal_ts", "admin_event_count", "earliest_action_ts",
        "earliest_action_source", "days_before_crisis", "response_class"})
public class CuratorProfileRow {
    @JsonProperty("chain_id") long chainId;
    @JsonProperty("chain") String chain;
    @JsonProperty("vault_address") String vaultAddress;
    @JsonProperty("vault_name") String vaultName;
    @JsonProperty("curator") String curator;
    @JsonProperty("exposure_status") String exposureStatus;
    @JsonProperty("peak_toxic_alloc_usd") double peakToxicAllocUsd;
    @JsonProperty("peak_ts") Long peakTs;
    @JsonProperty("alloc_at_crisis_usd") Double allocAtCrisisUsd;
    @JsonProperty("alloc_week_before_usd") Double allocWeekBeforeUsd;
    @JsonProperty("first_zero_alloc_ts") Long firstZeroAllocTs;
    @JsonProperty("first_cap_zero_ts") Long firstCapZeroTs;
    @JsonProperty("first_toxic_withdraw_ts") Long firstToxicWithdrawTs;
    @JsonProperty("last_toxic_withdraw_ts") Long lastToxicWithdrawTs;
    @JsonProperty("toxic_withdraw_count") int toxicWithdrawCount;
    @JsonProperty("toxic_supply_count") int toxicSupplyCount;
    @JsonProperty("queue_removal_ts") Long queueRemovalTs;
    @JsonProperty("admin_event_count") int adminEventCount;
    @JsonProperty("earliest_action_ts") Long earliestActionTs;
    @JsonProperty("earliest_action_source") String earliestActionSource;
    @JsonProperty("days_before_crisis") Double daysBeforeCrisis;
    @JsonProperty("response_class") String responseClass;

    public static CuratorProfileRow from(CuratorResponseProfile p) {
        return CuratorProfileRow.builder()
                .chainId(p.getVaultKey().chainId())
                .chain(p.getChainName())
                .vaultAddress(p.getVaultKey().address())
                .vaultName(p.getVaultName())
                .curator(p.getCuratorIdentity())
                .exposureStatus(p.getExposureStatus() == null ? null : p.getExposureStatus().name())
                .peakToxicAllocUsd(p.getPeakToxicAllocationUsd())
                .peakTs(p.getPeakTimestamp())
                .allocAtCrisisUsd(p.getAllocationAtCrisisUsd())
                .allocWeekBeforeUsd(p.getAllocationWeekBeforeUsd())
                .firstZeroAllocTs(p.getFirstZeroAllocationTs())
                .firstCapZeroTs(p.getFirstCapZeroTs())
                .firstToxicWithdrawTs(p.getFirstToxicWithdrawTs())
                .lastToxicWithdrawTs(p.getLastToxicWithdrawTs())
                .toxicWithdrawCount(p.getToxicWithdrawCount())
                .toxicSupplyCount(p.getToxicSupplyCount())
                .queueRemovalTs(p.getQueueRemovalTs())
                .adminEventCount(p.getAdminEventCount())
                .earliestActionTs(p.getEarliestActionTs())
                .earliestActionSource(p.getEarliestActionSource() == null ? null : p.getEarliestActionSource().name())
                .daysBeforeCrisis(p.getDaysBeforeCrisis())
                .responseClass(p.getResponseClass().name())
                .build();
    }
}
