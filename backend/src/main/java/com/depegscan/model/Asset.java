package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Asset {
    long chainId;
    String address;
    String symbol;
    String name;
    /** Token decimals; 18 when the API omits them. */
    int decimals;
    /** Independently sourced USD spot price; null when unknown. */
    Double spotPriceUsd;
}
