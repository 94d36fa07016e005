package com.depegscan.service.discovery;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Case-insensitive match against the configured toxic collateral symbols, minus the
 * false-positive exclusions (symbols that merely look similar).
 */
public class ToxicSymbolFilter {

    private final Set<String> toxic;
    private final Set<String> falsePositives;

    public ToxicSymbolFilter(Collection<String> toxicSymbols, Collection<String> falsePositives) {
        this.toxic = normalizeAll(toxicSymbols);
        this.falsePositives = normalizeAll(falsePositives);
    }

    public boolean isToxic(String symbol) {
        if (symbol == null || symbol.isBlank()) return false;
        String s = normalize(symbol);
        return toxic.contains(s) && !falsePositives.contains(s);
    }

    public Set<String> toxicSymbols() {
        return toxic;
    }

    private static Set<String> normalizeAll(Collection<String> in) {
        if (in == null) return Set.of();
        return in.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(ToxicSymbolFilter::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String normalize(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
