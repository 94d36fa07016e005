package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/** Per-market daily allocation series of a vault. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultHistoryDto {
    private String address;
    private HistoricalState historicalState;

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HistoricalState {
        private List<AllocationSeries> allocation;
    }

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AllocationSeries {
        private MarketRefDto market;
        private List<TimePointDto> supplyAssetsUsd;
        private List<TimePointDto> supplyCap;
    }
}
