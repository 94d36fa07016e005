package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MarketStressProfile {
    MarketKey marketKey;
    String chainName;
    String collateralSymbol;
    int samples;
    double peakUtilization;
    Long peakUtilizationTs;
    Long firstFullUtilizationTs;
    int hoursAtFullUtilizationAfterCrisis;
    Double utilizationAtCrisis;
}
