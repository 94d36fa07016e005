package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LiquidationEvent {
    MarketKey marketKey;
    String hash;
    long timestamp;
    String borrower;
    String liquidator;
    double seizedUsd;
    double repaidUsd;
    double badDebtUsd;
}
