package com.hold.domain.invoice;

import java.util.HexFormat;
import java.util.Locale;

final class Hex32 {

    private static final HexFormat HEX = HexFormat.of();

    private Hex32() {}

    static String normalize(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.length() != 64) {
            throw new IllegalArgumentException(what + " must be 32 bytes, got " + v.length() / 2);
        }
        for (int i = 0; i < v.length(); i++) {
            if (Character.digit(v.charAt(i), 16) < 0) {
                throw new IllegalArgumentException(what + " is not hex");
            }
        }
        return v;
    }

    static String encode(byte[] bytes, String what) {
        if (bytes == null || bytes.length != 32) {
            throw new IllegalArgumentException(what + " must be 32 bytes");
        }
        return HEX.formatHex(bytes);
    }

    static byte[] decode(String hex) {
        return HEX.parseHex(hex);
    }
}
