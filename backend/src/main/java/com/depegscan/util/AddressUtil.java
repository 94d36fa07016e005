package com.depegscan.util;

import java.util.Locale;

/**
 * Canonical forms for EVM addresses and market identifiers.
 */
public final class AddressUtil {
    private AddressUtil(){}

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    /**
     * Lenient canonical form for join keys (market unique keys, vault addresses):
     * trimmed and lower-cased. Rejects null/blank.
     */
    public static String canonical(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("identifier is null or blank");
        return id.trim().toLowerCase(Locale.ROOT);
    }

    /** Null, blank or the all-zero address. */
    public static boolean isZero(String addr) {
        if (addr == null || addr.isBlank()) return true;
        String a = addr.trim().toLowerCase(Locale.ROOT);
        if (a.startsWith("0x")) a = a.substring(2);
        for (int i = 0; i < a.length(); i++) {
            if (a.charAt(i) != '0') return false;
        }
        return true;
    }
}
