package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/** Vault admin (configuration) event with the cap / queue payload we care about. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AdminEventDto {
    private String hash;
    private Long timestamp;
    private String type;
    private EventData data;

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventData {
        private String cap;
        private MarketRefDto market;
        private List<MarketRefDto> withdrawQueue;
        private List<MarketRefDto> supplyQueue;
    }
}
