package com.depegscan.util;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Safe numeric coercion for API payloads: null, blank or malformed input yields the default
 * instead of an exception.
 */
public final class NumberUtil {
    private NumberUtil() {}

    public static BigInteger toBigInteger(String s) {
        if (s == null || s.isBlank()) return BigInteger.ZERO;
        String v = s.trim();
        try {
            return new BigInteger(v);
        } catch (NumberFormatException e) {
            // scientific notation or decimals ("1.5e21")
            try {
                return new BigDecimal(v).toBigInteger();
            } catch (NumberFormatException ignored) {
                return BigInteger.ZERO;
            }
        }
    }

    public static double toDouble(Double d) {
        return (d == null || d.isNaN() || d.isInfinite()) ? 0.0 : d;
    }

    public static double toDouble(String s) {
        if (s == null || s.isBlank()) return 0.0;
        try {
            double d = Double.parseDouble(s.trim());
            return (Double.isNaN(d) || Double.isInfinite(d)) ? 0.0 : d;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    /** Nullable variant for values whose absence matters (prices). */
    public static Double toDoubleOrNull(Double d) {
        return (d == null || d.isNaN() || d.isInfinite()) ? null : d;
    }

    public static long toLong(String s, long dflt) {
        if (s == null || s.isBlank()) return dflt;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            try {
                return new BigDecimal(s.trim()).longValue();
            } catch (NumberFormatException ignored) {
                return dflt;
            }
        }
    }

    public static Long toLongOrNull(String s) {
        if (s == null || s.isBlank()) return null;
        long v = toLong(s, Long.MIN_VALUE);
        return v == Long.MIN_VALUE ? null : v;
    }

    public static int toInt(Integer i, int dflt) {
        return i == null ? dflt : i;
    }

    /** a / b, or 0 when b is zero or either side is not finite. */
    public static double safeDiv(double a, double b) {
        if (b == 0.0 || Double.isNaN(a) || Double.isNaN(b) || Double.isInfinite(b)) return 0.0;
        double r = a / b;
        return (Double.isNaN(r) || Double.isInfinite(r)) ? 0.0 : r;
    }

    /** raw / 10^decimals as a double. */
    public static double scaleDown(BigInteger raw, int decimals) {
        if (raw == null) return 0.0;
        return new BigDecimal(raw).movePointLeft(Math.max(decimals, 0)).doubleValue();
    }
}
