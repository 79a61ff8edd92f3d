package com.hold.infrastructure.bolt11;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;

/**
 * Bech32 (BIP-173) without the 90 character limit, which lightning invoices exceed.
 */
final class Bech32 {

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int[] GENERATOR = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};

    private static final byte[] CHARSET_REV = new byte[128];

    static {
        Arrays.fill(CHARSET_REV, (byte) -1);
        for (int i = 0; i < CHARSET.length(); i++) {
            CHARSET_REV[CHARSET.charAt(i)] = (byte) i;
            CHARSET_REV[Character.toUpperCase(CHARSET.charAt(i))] = (byte) i;
        }
    }

    /**
     * @param data 5-bit words, checksum stripped
     */
    record Decoded(String hrp, byte[] data) {}

    private Bech32() {}

    static String encode(String hrp, byte[] data) {
        String lowerHrp = hrp.toLowerCase(Locale.ROOT);
        byte[] checksum = createChecksum(lowerHrp, data);
        StringBuilder sb = new StringBuilder(lowerHrp.length() + 1 + data.length + checksum.length);
        sb.append(lowerHrp).append('1');
        for (byte b : data) sb.append(CHARSET.charAt(b));
        for (byte b : checksum) sb.append(CHARSET.charAt(b));
        return sb.toString();
    }

    static Decoded decode(String str) {
        boolean lower = false;
        boolean upper = false;
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c < 33 || c > 126) throw new IllegalArgumentException("invalid character at " + i);
            if (c >= 'a' && c <= 'z') lower = true;
            if (c >= 'A' && c <= 'Z') upper = true;
        }
        if (lower && upper) throw new IllegalArgumentException("mixed case");

        int pos = str.lastIndexOf('1');
        if (pos < 1) throw new IllegalArgumentException("missing human-readable part");
        int dataLen = str.length() - 1 - pos;
        if (dataLen < 6) throw new IllegalArgumentException("data part too short");

        byte[] values = new byte[dataLen];
        for (int i = 0; i < dataLen; i++) {
            char c = str.charAt(pos + 1 + i);
            if (c >= 128 || CHARSET_REV[c] == -1) {
                throw new IllegalArgumentException("invalid character '" + c + "'");
            }
            values[i] = CHARSET_REV[c];
        }

        String hrp = str.substring(0, pos).toLowerCase(Locale.ROOT);
        if (polymod(concat(expandHrp(hrp), values)) != 1) {
            throw new IllegalArgumentException("invalid checksum");
        }
        return new Decoded(hrp, Arrays.copyOfRange(values, 0, values.length - 6));
    }

    /**
     * Regroups bits, e.g. 8-bit bytes into 5-bit words. With {@code pad} the last group is
     * zero-filled; without it, leftover bits must be zero padding.
     */
    static byte[] convertBits(byte[] in, int fromBits, int toBits, boolean pad) {
        int acc = 0;
        int bits = 0;
        int maxv = (1 << toBits) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream(in.length * fromBits / toBits + 1);
        for (byte b : in) {
            int value = b & 0xff;
            if ((value >>> fromBits) != 0) {
                throw new IllegalArgumentException("value out of range: " + value);
            }
            acc = (acc << fromBits) | value;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxv);
            }
        }
        if (pad) {
            if (bits > 0) out.write((acc << (toBits - bits)) & maxv);
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxv) != 0) {
            throw new IllegalArgumentException("invalid padding");
        }
        return out.toByteArray();
    }

    private static int polymod(byte[] values) {
        int c = 1;
        for (byte v : values) {
            int c0 = (c >>> 25) & 0xff;
            c = ((c & 0x1ffffff) << 5) ^ (v & 0xff);
            for (int i = 0; i < 5; i++) {
                if (((c0 >>> i) & 1) != 0) c ^= GENERATOR[i];
            }
        }
        return c;
    }

    private static byte[] expandHrp(String hrp) {
        int len = hrp.length();
        byte[] ret = new byte[len * 2 + 1];
        for (int i = 0; i < len; i++) {
            int c = hrp.charAt(i) & 0x7f;
            ret[i] = (byte) ((c >>> 5) & 0x07);
            ret[i + len + 1] = (byte) (c & 0x1f);
        }
        ret[len] = 0;
        return ret;
    }

    private static byte[] createChecksum(String hrp, byte[] values) {
        byte[] enc = concat(concat(expandHrp(hrp), values), new byte[6]);
        int mod = polymod(enc) ^ 1;
        byte[] ret = new byte[6];
        for (int i = 0; i < 6; i++) {
            ret[i] = (byte) ((mod >>> 5 * (5 - i)) & 31);
        }
        return ret;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
