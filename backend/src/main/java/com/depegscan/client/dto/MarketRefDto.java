package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/** Light market reference embedded in vault allocations, reallocations and admin events. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketRefDto {
    private String uniqueKey;
    private String lltv;
    private AssetDto loanAsset;
    private AssetDto collateralAsset;
}
