package com.hold.infrastructure.bolt11;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Bitcoin networks and their bolt11 currency prefixes.
 */
public enum Network {
    BITCOIN("bc"),
    TESTNET("tb"),
    SIGNET("tbs"),
    REGTEST("bcrt");

    private final String prefix;

    Network(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Network parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("network is blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("mainnet")) return BITCOIN;
        for (Network n : values()) {
            if (n.label().equals(v)) return n;
        }
        throw new IllegalArgumentException("unknown network: " + value);
    }

    /**
     * Network whose prefix starts {@code rest}; the longest prefix wins ("bcrt" over "bc").
     */
    static Optional<Network> matchPrefix(String rest) {
        return Arrays.stream(values())
                .sorted(Comparator.comparingInt((Network n) -> n.prefix.length()).reversed())
                .filter(n -> rest.startsWith(n.prefix))
                .findFirst();
    }
}
