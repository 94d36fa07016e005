package com.depegscan.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class ReallocationEvent {
    String id;
    String hash;
    long timestamp;
    VaultKey vaultKey;
    MarketKey marketKey;
    Direction direction;
    BigInteger assets;

    public enum Direction {
        SUPPLY, WITHDRAW, OTHER;

        public static Direction fromType(String type) {
            if ("ReallocateWithdraw".equalsIgnoreCase(type)) return WITHDRAW;
            if ("ReallocateSupply".equalsIgnoreCase(type)) return SUPPLY;
            return OTHER;
        }
    }
}
