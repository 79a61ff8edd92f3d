package com.hold.domain.invoice;

/**
 * 32-byte payment hash, held as lowercase hex.
 */
public record PaymentHash(String hex) {

    public PaymentHash {
        hex = Hex32.normalize(hex, "payment hash");
    }

    public static PaymentHash of(byte[] bytes) {
        return new PaymentHash(Hex32.encode(bytes, "payment hash"));
    }

    public byte[] bytes() {
        return Hex32.decode(hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
