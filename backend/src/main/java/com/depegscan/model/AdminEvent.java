package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Vault configuration event. {@code cap}/{@code marketKey} are set for cap events,
 * {@code withdrawQueue} for withdraw-queue updates.
 */
@Value
@Builder
public class AdminEvent {
    String hash;
    long timestamp;
    String type;
    BigInteger cap;
    MarketKey marketKey;
    List<MarketKey> withdrawQueue;

    public boolean isCapEvent() {
        return "SetCap".equalsIgnoreCase(type) || "SubmitCap".equalsIgnoreCase(type);
    }

    public boolean isWithdrawQueueUpdate() {
        return "SetWithdrawQueue".equalsIgnoreCase(type) && withdrawQueue != null;
    }
}
