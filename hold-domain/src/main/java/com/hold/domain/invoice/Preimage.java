package com.hold.domain.invoice;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

public record Preimage(String hex) {

    private static final SecureRandom RANDOM = new SecureRandom();

    public Preimage {
        hex = Hex32.normalize(hex, "preimage");
    }

    public static Preimage of(byte[] bytes) {
        return new Preimage(Hex32.encode(bytes, "preimage"));
    }

    public static Preimage random() {
        byte[] b = new byte[32];
        RANDOM.nextBytes(b);
        return of(b);
    }

    public byte[] bytes() {
        return Hex32.decode(hex);
    }

    /** sha256 of the preimage bytes. */
    public PaymentHash paymentHash() {
        try {
            return PaymentHash.of(MessageDigest.getInstance("SHA-256").digest(bytes()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean unlocks(PaymentHash hash) {
        return paymentHash().equals(hash);
    }

    @Override
    public String toString() {
        return "Preimage[***]";
    }
}
