package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * DTO for the lending API "Market" object (listing and single-entity queries).
 * Raw token amounts are kept as strings: they are BigInts on the wire.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketDto {
    private String uniqueKey;
    private Boolean listed;
    private String lltv;            // 1e18-scaled
    private Long creationTimestamp;
    private AssetDto loanAsset;
    private AssetDto collateralAsset;
    private OracleDto oracle;
    private String oracleAddress;
    private MorphoBlueRef morphoBlue;
    private State state;
    private BadDebt badDebt;
    private BadDebt realizedBadDebt;
    private List<Warning> warnings;
    private List<VaultRef> supplyingVaults;

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MorphoBlueRef {
        private ChainRef chain;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChainRef {
        private Long id;
        private String network;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class State {
        private Long timestamp;
        private String supplyAssets;
        private String borrowAssets;
        private String collateralAssets;
        private String liquidityAssets;
        private Double supplyAssetsUsd;
        private Double borrowAssetsUsd;
        private Double collateralAssetsUsd;
        private Double liquidityAssetsUsd;
        private Double utilization;
        private String price;       // oracle price, 1e36-scaled
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BadDebt {
        private String underlying;
        private Double usd;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Warning {
        private String type;
        private String level;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VaultRef {
        private String address;
        private String name;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OracleDto {
        private String address;
        private String type;
        private OracleData data;
    }

    /** Union of the Chainlink-style oracle data fragments we query. */
    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OracleData {
        private AddressRef baseFeedOne;
        private AddressRef baseFeedTwo;
        private AddressRef quoteFeedOne;
        private AddressRef quoteFeedTwo;
        private AddressRef baseOracleVault;
        private AddressRef quoteOracleVault;
        private String scaleFactor;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AddressRef {
        private String address;
    }
}
