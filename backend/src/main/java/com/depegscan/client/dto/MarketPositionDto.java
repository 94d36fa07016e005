package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/** A user's current position in one market. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketPositionDto {
    private UserRef user;
    private Double healthFactor;
    private MarketRefDto market;
    private PositionState state;

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserRef {
        private String address;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PositionState {
        private String collateral;
        private Double collateralUsd;
        private String borrowAssets;
        private Double borrowAssetsUsd;
    }
}
