package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/** One curator reallocation transaction leg (supply into / withdraw from a market). */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReallocationDto {
    private String id;
    private Long timestamp;
    private String hash;
    private String type;        // ReallocateSupply / ReallocateWithdraw
    private String assets;
    private VaultRef vault;
    private MarketRefDto market;

    @Data @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VaultRef {
        private String address;
        private String name;
    }
}
