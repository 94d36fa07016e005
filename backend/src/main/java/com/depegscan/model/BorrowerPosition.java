package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BorrowerPosition {
    MarketKey marketKey;
    String borrower;
    double borrowUsd;
    double collateralUsd;
    /** Null when the API reports none (no borrow). */
    Double healthFactor;
}
