package com.depegscan.service.curator;

import com.depegscan.config.CrisisTimeline;
import com.depegscan.model.ActionSource;
import com.depegscan.model.AdminEvent;
import com.depegscan.model.AllocationPoint;
import com.depegscan.model.CuratorResponseProfile;
import com.depegscan.model.ExposureStatus;
import com.depegscan.model.MarketKey;
import com.depegscan.model.ReallocationEvent;
import com.depegscan.model.ResponseClass;
import com.depegscan.model.VaultEventHistory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Dates a curator's earliest decisive action against the toxic markets and buckets it
 * relative to the crisis. Any of the three streams may be empty.
 */
public class CuratorResponseClassifier {

    private final CrisisTimeline timeline;
    private final double zeroAllocationUsd;

    public CuratorResponseClassifier(CrisisTimeline timeline, double zeroAllocationUsd) {
        this.timeline = timeline;
        this.zeroAllocationUsd = zeroAllocationUsd;
    }

    public CuratorResponseProfile classify(VaultEventHistory history, Set<MarketKey> toxicMarkets, ExposureStatus status) {
        // allocation stream: daily total across toxic markets
        TreeMap<Long, Double> daily = new TreeMap<>();
        for (AllocationPoint p : history.allocations()) {
            if (!toxicMarkets.contains(p.marketKey())) continue;
            daily.merge(p.timestamp(), p.supplyUsd(), Double::sum);
        }
        double peak = 0.0;
        Long peakTs = null;
        for (Map.Entry<Long, Double> e : daily.entrySet()) {
            if (peakTs == null || e.getValue() > peak) {
                peak = e.getValue();
                peakTs = e.getKey();
            }
        }
        Long firstZero = null;
        if (peakTs != null && peak >= zeroAllocationUsd) {
            for (Map.Entry<Long, Double> e : daily.tailMap(peakTs, true).entrySet()) {
                if (e.getValue() < zeroAllocationUsd) {
                    firstZero = e.getKey();
                    break;
                }
            }
        }

        // admin stream
        List<AdminEvent> admin = history.adminEvents().stream()
                .sorted(Comparator.comparingLong(AdminEvent::getTimestamp))
                .toList();
        Long firstCapZero = admin.stream()
                .filter(AdminEvent::isCapEvent)
                .filter(e -> e.getCap() != null && e.getCap().signum() == 0)
                .filter(e -> e.getMarketKey() != null && toxicMarkets.contains(e.getMarketKey()))
                .map(AdminEvent::getTimestamp)
                .findFirst().orElse(null);
        Long queueRemoval = queueRemovalTs(admin, toxicMarkets);

        // reallocation stream
        List<ReallocationEvent> toxicLegs = history.reallocations().stream()
                .filter(r -> r.getMarketKey() != null && toxicMarkets.contains(r.getMarketKey()))
                .sorted(Comparator.comparingLong(ReallocationEvent::getTimestamp))
                .toList();
        List<ReallocationEvent> withdraws = toxicLegs.stream()
                .filter(r -> r.getDirection() == ReallocationEvent.Direction.WITHDRAW)
                .toList();
        int supplies = (int) toxicLegs.stream()
                .filter(r -> r.getDirection() == ReallocationEvent.Direction.SUPPLY)
                .count();
        Long firstWithdraw = withdraws.isEmpty() ? null : withdraws.get(0).getTimestamp();
        Long lastWithdraw = withdraws.isEmpty() ? null : withdraws.get(withdraws.size() - 1).getTimestamp();

        // earliest decisive action; ties keep the earlier stream in this order
        Long earliest = null;
        ActionSource source = null;
        if (firstZero != null) {
            earliest = firstZero;
            source = ActionSource.ALLOCATION_ZERO;
        }
        if (firstCapZero != null && (earliest == null || firstCapZero < earliest)) {
            earliest = firstCapZero;
            source = ActionSource.CAP_ZERO;
        }
        if (firstWithdraw != null && (earliest == null || firstWithdraw < earliest)) {
            earliest = firstWithdraw;
            source = ActionSource.TOXIC_WITHDRAW;
        }

        Double days = null;
        ResponseClass responseClass;
        if (earliest != null) {
            days = (timeline.crisis() - earliest) / (double) CrisisTimeline.DAY_SECONDS;
            responseClass = ResponseClass.fromDaysBeforeCrisis(days);
        } else {
            responseClass = ResponseClass.withoutAction(status);
        }

        return CuratorResponseProfile.builder()
                .vaultKey(history.vaultKey())
                .exposureStatus(status)
                .peakToxicAllocationUsd(peak)
                .peakTimestamp(peakTs)
                .allocationAtCrisisUsd(firstInDay(daily, timeline.crisis()))
                .allocationWeekBeforeUsd(firstInDay(daily, timeline.crisis() - 7 * CrisisTimeline.DAY_SECONDS))
                .firstZeroAllocationTs(firstZero)
                .firstCapZeroTs(firstCapZero)
                .firstToxicWithdrawTs(firstWithdraw)
                .lastToxicWithdrawTs(lastWithdraw)
                .toxicWithdrawCount(withdraws.size())
                .toxicSupplyCount(supplies)
                .queueRemovalTs(queueRemoval)
                .adminEventCount(admin.size())
                .earliestActionTs(earliest)
                .earliestActionSource(source)
                .daysBeforeCrisis(days)
                .responseClass(responseClass)
                .build();
    }

    /**
     * First withdraw-queue update that leaves no toxic market in the queue, after an update
     * that still had one.
     */
    static Long queueRemovalTs(List<AdminEvent> sortedAdmin, Set<MarketKey> toxicMarkets) {
        boolean hadToxic = false;
        for (AdminEvent e : sortedAdmin) {
            if (!e.isWithdrawQueueUpdate()) continue;
            boolean hasToxic = e.getWithdrawQueue().stream().anyMatch(toxicMarkets::contains);
            if (hadToxic && !hasToxic) return e.getTimestamp();
            hadToxic = hasToxic;
        }
        return null;
    }

    private static Double firstInDay(TreeMap<Long, Double> daily, long dayStart) {
        Map.Entry<Long, Double> e = daily.ceilingEntry(dayStart);
        if (e == null || e.getKey() >= dayStart + CrisisTimeline.DAY_SECONDS) return null;
        return e.getValue();
    }
}
