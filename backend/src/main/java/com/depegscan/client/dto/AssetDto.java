package com.depegscan.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/** Token reference as returned by the lending API (loan / collateral / vault asset). */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssetDto {
    private String address;
    private String symbol;
    private String name;
    private Integer decimals;
    private Double priceUsd;
}
