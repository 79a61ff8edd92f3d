package com.hold.infrastructure.bolt11;

import com.hold.application.ports.DecodedInvoice;
import com.hold.application.ports.EncodedInvoice;
import com.hold.application.ports.InvoiceDecoder;
import com.hold.application.ports.InvoiceEncoder;
import com.hold.application.ports.InvoiceRequest;
import com.hold.application.ports.RoutingHint;
import com.hold.domain.invoice.PaymentHash;
import org.bitcoinj.core.Sha256Hash;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * BOLT11 payment requests: signs invoices with the node key and parses invoices from anywhere.
 */
public final class Bolt11Codec implements InvoiceEncoder, InvoiceDecoder {

    static final long DEFAULT_EXPIRY_SECONDS = 3600;
    static final int DEFAULT_MIN_FINAL_CLTV_EXPIRY = 18;

    private static final int TIMESTAMP_WORDS = 7;
    private static final int SIGNATURE_WORDS = 104;
    private static final int HOP_BYTES = 33 + 8 + 4 + 4 + 2;

    // tag values are the bech32 charset positions of the field letters
    private static final int TAG_PAYMENT_HASH = 1;      // p
    private static final int TAG_ROUTE = 3;             // r
    private static final int TAG_FEATURES = 5;          // 9
    private static final int TAG_EXPIRY = 6;            // x
    private static final int TAG_DESCRIPTION = 13;      // d
    private static final int TAG_PAYMENT_SECRET = 16;   // s
    private static final int TAG_PAYEE = 19;            // n
    private static final int TAG_DESCRIPTION_HASH = 23; // h
    private static final int TAG_MIN_FINAL_CLTV = 24;   // c

    /** var_onion_optin (required), payment_secret (required), basic_mpp (optional). */
    private static final int[] FEATURE_BITS = {8, 14, 17};

    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Network network;
    private final NodeKey nodeKey;
    private final Clock clock;

    public Bolt11Codec(Network network, NodeKey nodeKey, Clock clock) {
        this.network = network;
        this.nodeKey = nodeKey;
        this.clock = clock;
    }

    @Override
    public String nodeId() {
        return nodeKey.publicKeyHex();
    }

    public Network network() {
        return network;
    }

    @Override
    public EncodedInvoice encode(InvoiceRequest request) {
        byte[] secret = new byte[32];
        RANDOM.nextBytes(secret);

        String hrp = "ln" + network.prefix() + amountPart(request.amountMsat());

        Words w = new Words();
        w.writeInt(clock.instant().getEpochSecond(), TIMESTAMP_WORDS);
        w.writeField(TAG_PAYMENT_HASH, toWords(request.paymentHash().bytes()));
        w.writeField(TAG_PAYMENT_SECRET, toWords(secret));
        if (request.descriptionHash() != null) {
            w.writeField(TAG_DESCRIPTION_HASH, toWords(HEX.parseHex(request.descriptionHash())));
        } else {
            String memo = request.memo() == null ? "" : request.memo();
            w.writeField(TAG_DESCRIPTION, toWords(memo.getBytes(StandardCharsets.UTF_8)));
        }
        w.writeField(TAG_EXPIRY, intWords(request.expirySeconds()));
        w.writeField(TAG_MIN_FINAL_CLTV, intWords(request.minFinalCltvExpiry()));
        for (RoutingHint hint : request.routingHints()) {
            w.writeField(TAG_ROUTE, toWords(routeBytes(hint)));
        }
        w.writeField(TAG_FEATURES, featureWords(FEATURE_BITS));

        byte[] data = w.toArray();
        byte[] signature = nodeKey.signRecoverable(signingDigest(hrp, data));
        byte[] signed = concat(data, Bech32.convertBits(signature, 8, 5, true));

        return new EncodedInvoice(Bech32.encode(hrp, signed), HEX.formatHex(secret));
    }

    /**
     * Parses and verifies the invoice, which must be for the configured network.
     */
    @Override
    public DecodedInvoice decode(String bolt11) {
        DecodedInvoice decoded = parse(bolt11);
        if (!decoded.network().equals(network.label())) {
            throw new IllegalArgumentException("invoice is for network " + decoded.network()
                    + ", node runs on " + network.label());
        }
        return decoded;
    }

    /**
     * Parses and verifies an invoice of any network.
     *
     * @throws IllegalArgumentException on malformed data or a bad signature
     */
    public static DecodedInvoice parse(String bolt11) {
        if (bolt11 == null || bolt11.isBlank()) {
            throw new IllegalArgumentException("invoice is blank");
        }
        String input = bolt11.trim();
        if (input.regionMatches(true, 0, "lightning:", 0, 10)) {
            input = input.substring(10);
        }
        Bech32.Decoded bech = Bech32.decode(input);

        String hrp = bech.hrp();
        if (!hrp.startsWith("ln")) {
            throw new IllegalArgumentException("not a lightning invoice: " + hrp);
        }
        String rest = hrp.substring(2);
        Network net = Network.matchPrefix(rest)
                .orElseThrow(() -> new IllegalArgumentException("unknown currency prefix in " + hrp));
        Long amountMsat = parseAmount(rest.substring(net.prefix().length()));

        byte[] words = bech.data();
        if (words.length < TIMESTAMP_WORDS + SIGNATURE_WORDS) {
            throw new IllegalArgumentException("invoice too short");
        }
        int end = words.length - SIGNATURE_WORDS;
        byte[] data = Arrays.copyOfRange(words, 0, end);
        byte[] signature = Bech32.convertBits(Arrays.copyOfRange(words, end, words.length), 5, 8, false);
        String recovered = NodeKey.recover(signature, signingDigest(hrp, data));

        long timestamp = readInt(words, 0, TIMESTAMP_WORDS);

        PaymentHash paymentHash = null;
        String paymentSecret = null;
        String description = null;
        String descriptionHash = null;
        String payee = null;
        long expiry = DEFAULT_EXPIRY_SECONDS;
        int minFinalCltv = DEFAULT_MIN_FINAL_CLTV_EXPIRY;
        List<RoutingHint> hints = new ArrayList<>();

        int pos = TIMESTAMP_WORDS;
        while (pos < end) {
            if (pos + 3 > end) throw new IllegalArgumentException("truncated field at " + pos);
            int tag = words[pos];
            int len = words[pos + 1] * 32 + words[pos + 2];
            int start = pos + 3;
            if (start + len > end) throw new IllegalArgumentException("field exceeds data at " + pos);
            byte[] field = Arrays.copyOfRange(words, start, start + len);
            pos = start + len;

            switch (tag) {
                case TAG_PAYMENT_HASH -> {
                    if (len == 52) paymentHash = PaymentHash.of(fromWords(field));
                }
                case TAG_PAYMENT_SECRET -> {
                    if (len == 52) paymentSecret = HEX.formatHex(fromWords(field));
                }
                case TAG_DESCRIPTION -> description = new String(fromWords(field), StandardCharsets.UTF_8);
                case TAG_DESCRIPTION_HASH -> {
                    if (len == 52) descriptionHash = HEX.formatHex(fromWords(field));
                }
                case TAG_EXPIRY -> expiry = readInt(field, 0, len);
                case TAG_MIN_FINAL_CLTV -> minFinalCltv = readIntField(field, len, "min final CLTV expiry");
                case TAG_PAYEE -> {
                    if (len == 53) payee = HEX.formatHex(fromWords(field));
                }
                case TAG_ROUTE -> hints.add(parseRoute(fromWords(field)));
                default -> {
                    // unknown fields are skipped
                }
            }
        }

        if (paymentHash == null) {
            throw new IllegalArgumentException("missing payment hash");
        }
        if (payee != null && !payee.equals(recovered)) {
            throw new IllegalArgumentException("signature does not match payee " + payee);
        }

        return new DecodedInvoice(net.label(), paymentHash, amountMsat, paymentSecret, description,
                descriptionHash, expiry, minFinalCltv, Instant.ofEpochSecond(timestamp),
                payee != null ? payee : recovered, hints);
    }

    // --- amount ---

    static String amountPart(Long msat) {
        if (msat == null) return "";
        if (msat % 100_000_000_000L == 0) return Long.toString(msat / 100_000_000_000L);
        if (msat % 100_000_000L == 0) return (msat / 100_000_000L) + "m";
        if (msat % 100_000L == 0) return (msat / 100_000L) + "u";
        if (msat % 100L == 0) return (msat / 100L) + "n";
        return Math.multiplyExact(msat, 10L) + "p";
    }

    static Long parseAmount(String s) {
        if (s.isEmpty()) return null;
        char last = s.charAt(s.length() - 1);
        String digits = Character.isDigit(last) ? s : s.substring(0, s.length() - 1);
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("invalid amount: " + s);
        }
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            throw new IllegalArgumentException("amount has leading zeros: " + s);
        }
        try {
            long n = Long.parseLong(digits);
            long msat = switch (last) {
                case 'm' -> Math.multiplyExact(n, 100_000_000L);
                case 'u' -> Math.multiplyExact(n, 100_000L);
                case 'n' -> Math.multiplyExact(n, 100L);
                case 'p' -> {
                    if (n % 10 != 0) throw new IllegalArgumentException("sub-millisatoshi amount: " + s);
                    yield n / 10;
                }
                default -> {
                    if (!Character.isDigit(last)) throw new IllegalArgumentException("unknown multiplier " + last);
                    yield Math.multiplyExact(n, 100_000_000_000L);
                }
            };
            if (msat <= 0) throw new IllegalArgumentException("amount must be positive: " + s);
            return msat;
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("amount out of range: " + s, e);
        }
    }

    // --- routing hints ---

    private static byte[] routeBytes(RoutingHint hint) {
        ByteBuffer buf = ByteBuffer.allocate(hint.hops().size() * HOP_BYTES);
        for (RoutingHint.Hop hop : hint.hops()) {
            buf.put(HEX.parseHex(hop.publicKey()));
            buf.putLong(hop.shortChannelId());
            buf.putInt((int) hop.baseFeeMsat());
            buf.putInt((int) hop.ppmFee());
            buf.putShort((short) hop.cltvExpiryDelta());
        }
        return buf.array();
    }

    private static RoutingHint parseRoute(byte[] bytes) {
        if (bytes.length == 0 || bytes.length % HOP_BYTES != 0) {
            throw new IllegalArgumentException("routing hint has invalid length " + bytes.length);
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        List<RoutingHint.Hop> hops = new ArrayList<>();
        while (buf.hasRemaining()) {
            byte[] pub = new byte[33];
            buf.get(pub);
            long scid = buf.getLong();
            long baseFee = Integer.toUnsignedLong(buf.getInt());
            long ppm = Integer.toUnsignedLong(buf.getInt());
            int cltvDelta = Short.toUnsignedInt(buf.getShort());
            hops.add(new RoutingHint.Hop(HEX.formatHex(pub), scid, baseFee, ppm, cltvDelta));
        }
        return new RoutingHint(hops);
    }

    // --- 5-bit words ---

    static byte[] signingDigest(String hrp, byte[] dataWords) {
        byte[] preimage = concat(hrp.getBytes(StandardCharsets.UTF_8), Bech32.convertBits(dataWords, 5, 8, true));
        return Sha256Hash.hash(preimage);
    }

    private static byte[] toWords(byte[] bytes) {
        return Bech32.convertBits(bytes, 8, 5, true);
    }

    private static byte[] fromWords(byte[] words) {
        // trailing pad bits are dropped without checking them, as other decoders do
        int bytes = words.length * 5 / 8;
        byte[] full = Bech32.convertBits(words, 5, 8, true);
        return Arrays.copyOf(full, bytes);
    }

    static byte[] intWords(long value) {
        if (value < 0) throw new IllegalArgumentException("negative value " + value);
        int bits = 64 - Long.numberOfLeadingZeros(value);
        int n = Math.max(1, (bits + 4) / 5);
        byte[] out = new byte[n];
        for (int i = n - 1; i >= 0; i--) {
            out[i] = (byte) (value & 31);
            value >>>= 5;
        }
        return out;
    }

    static byte[] featureWords(int[] bits) {
        int max = Arrays.stream(bits).max().orElse(0);
        int n = max / 5 + 1;
        byte[] out = new byte[n];
        for (int bit : bits) {
            out[n - 1 - bit / 5] |= (byte) (1 << (bit % 5));
        }
        return out;
    }

    private static long readInt(byte[] words, int from, int count) {
        if (count > 12) throw new IllegalArgumentException("integer field too long");
        long v = 0;
        for (int i = from; i < from + count; i++) {
            v = (v << 5) | words[i];
        }
        return v;
    }

    private static int readIntField(byte[] field, int len, String name) {
        long v = readInt(field, 0, len);
        if (v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " " + v + " out of range");
        }
        return (int) v;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    private static final class Words {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        void writeInt(long value, int count) {
            for (int i = count - 1; i >= 0; i--) {
                out.write((int) ((value >>> (5 * i)) & 31));
            }
        }

        void writeField(int tag, byte[] words) {
            if (words.length >= 1024) throw new IllegalArgumentException("field too long");
            out.write(tag);
            writeInt(words.length, 2);
            out.write(words, 0, words.length);
        }

        byte[] toArray() {
            return out.toByteArray();
        }
    }
}
