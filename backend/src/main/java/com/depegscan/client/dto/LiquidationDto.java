package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/** One MarketLiquidation transaction. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LiquidationDto {
    private String hash;
    private Long timestamp;
    private Long blockNumber;
    private String type;
    private UserRef user;
    private LiquidationData data;

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserRef {
        private String address;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LiquidationData {
        private String seizedAssets;
        private String repaidAssets;
        private Double seizedAssetsUsd;
        private Double repaidAssetsUsd;
        private Double badDebtAssetsUsd;
        private String liquidator;
        private MarketRefDto market;
    }
}
