package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * DTO for the lending API "Vault" object with its live state and allocation list.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultDto {
    private String address;
    private String name;
    private String symbol;
    private Boolean listed;
    private Long creationTimestamp;
    private AssetDto asset;
    private MarketDto.ChainRef chain;
    private State state;
    private PublicAllocatorConfig publicAllocatorConfig;

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class State {
        private String totalAssets;
        private Double totalAssetsUsd;
        private Double sharePriceNumber;
        private Double sharePriceUsd;
        private Double netApy;
        private Double fee;
        private String timelock;
        private String curator;
        private String owner;
        private String guardian;
        private List<Curator> curators;
        private List<Allocation> allocation;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Curator {
        private String name;
        private Boolean verified;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Allocation {
        private MarketRefDto market;
        private String supplyAssets;
        private Double supplyAssetsUsd;
        private String supplyCap;
        private Double supplyCapUsd;
        private Boolean enabled;
        private String removableAt;
        private String pendingSupplyCap;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PublicAllocatorConfig {
        private String admin;
        private String fee;
    }
}
