package com.depegscan.model;

import com.depegscan.util.AddressUtil;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.stream.Stream;

/**
 * Oracle configuration of a market as far as the API exposes it.
 */
@Value
@Builder
public class OracleDescriptor {
    String address;
    String type;
    String baseFeedOne;
    String baseFeedTwo;
    String quoteFeedOne;
    String quoteFeedTwo;
    String baseOracleVault;
    String quoteOracleVault;
    BigInteger scaleFactor;
    /** False when the feed projection was unavailable and only address/type are known. */
    boolean dataAvailable;

    /**
     * No live feed and no vault conversion behind the oracle: the price never moves.
     */
    public boolean isHardcoded() {
        if (!dataAvailable) {
            return "Unknown".equalsIgnoreCase(type);
        }
        boolean noFeeds = Stream.of(baseFeedOne, baseFeedTwo, quoteFeedOne, quoteFeedTwo).allMatch(AddressUtil::isZero);
        return noFeeds && !isVaultBased();
    }

    public boolean isVaultBased() {
        return !AddressUtil.isZero(baseOracleVault) || !AddressUtil.isZero(quoteOracleVault);
    }
}
