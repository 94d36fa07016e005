package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketHistoryDto {
    private String uniqueKey;
    private HistoricalState historicalState;

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HistoricalState {
        private List<TimePointDto> utilization;
        private List<TimePointDto> supplyAssetsUsd;
        private List<TimePointDto> borrowAssetsUsd;
    }
}
