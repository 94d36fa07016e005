package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/** Daily share price and TVL series of a vault. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultSharePriceHistoryDto {
    private String address;
    private HistoricalState historicalState;

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HistoricalState {
        private List<TimePointDto> sharePriceNumber;
        private List<TimePointDto> totalAssetsUsd;
    }
}
