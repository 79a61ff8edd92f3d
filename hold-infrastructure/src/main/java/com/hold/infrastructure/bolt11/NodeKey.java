package com.hold.infrastructure.bolt11;

import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * secp256k1 key that signs our invoices, with recoverable signatures as bolt11 needs them.
 */
public final class NodeKey {

    private static final Logger log = LoggerFactory.getLogger(NodeKey.class);
    private static final HexFormat HEX = HexFormat.of();

    private final ECKey key;

    private NodeKey(ECKey key) {
        this.key = key;
    }

    /**
     * Loads the configured private key, or generates a throwaway one when none is set.
     */
    public static NodeKey fromConfig(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            NodeKey generated = new NodeKey(new ECKey());
            log.warn("No node private key configured, generated ephemeral key {}. "
                    + "Invoices signed with it cannot be verified after a restart.", generated.publicKeyHex());
            return generated;
        }
        return fromPrivateHex(privateKeyHex);
    }

    public static NodeKey fromPrivateHex(String hex) {
        byte[] priv;
        try {
            priv = HEX.parseHex(hex.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("node private key is not hex", e);
        }
        if (priv.length != 32) {
            throw new IllegalArgumentException("node private key must be 32 bytes");
        }
        return new NodeKey(ECKey.fromPrivate(priv, true));
    }

    public String publicKeyHex() {
        return HEX.formatHex(key.getPubKey());
    }

    /**
     * Signs a 32-byte digest.
     *
     * @return 64 bytes r||s followed by the recovery id
     */
    public byte[] signRecoverable(byte[] digest) {
        Sha256Hash hash = Sha256Hash.wrap(digest);
        ECKey.ECDSASignature sig = key.sign(hash);
        byte[] pub = key.getPubKey();
        for (int recId = 0; recId < 4; recId++) {
            ECKey recovered = ECKey.recoverFromSignature(recId, sig, hash, true);
            if (recovered != null && Arrays.equals(recovered.getPubKey(), pub)) {
                byte[] out = new byte[65];
                System.arraycopy(Utils.bigIntegerToBytes(sig.r, 32), 0, out, 0, 32);
                System.arraycopy(Utils.bigIntegerToBytes(sig.s, 32), 0, out, 32, 32);
                out[64] = (byte) recId;
                return out;
            }
        }
        throw new IllegalStateException("could not find recovery id for signature");
    }

    /**
     * Recovers the compressed public key that produced {@code signature} over {@code digest}.
     *
     * @throws IllegalArgumentException when no key can be recovered
     */
    public static String recover(byte[] signature, byte[] digest) {
        if (signature.length != 65) {
            throw new IllegalArgumentException("signature must be 65 bytes");
        }
        int recId = signature[64];
        if (recId < 0 || recId > 3) {
            throw new IllegalArgumentException("invalid recovery id " + recId);
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        ECKey recovered;
        try {
            recovered = ECKey.recoverFromSignature(recId, new ECKey.ECDSASignature(r, s),
                    Sha256Hash.wrap(digest), true);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid signature", e);
        }
        if (recovered == null) {
            throw new IllegalArgumentException("invalid signature");
        }
        return HEX.formatHex(recovered.getPubKey());
    }
}
