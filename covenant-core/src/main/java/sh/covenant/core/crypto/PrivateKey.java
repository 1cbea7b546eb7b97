// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.covenant.core.types.Address;
import sh.covenant.primitives.Hex;

/**
 * secp256k1 private key with signing and signer recovery.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x1234...");
 * Address address = key.toAddress();
 *
 * byte[] digest = Keccak256.hash(message);
 * Signature signature = key.sign(digest);
 *
 * Address recovered = PrivateKey.recoverAddress(digest, signature);
 * assert recovered.equals(address);
 * }</pre>
 *
 * <p>
 * Implements {@link Destroyable}: after {@link #destroy()} every operation that needs
 * the key material throws {@link IllegalStateException}.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed = false;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }

        try {
            this.privateKeyValue = new BigInteger(1, keyBytes);

            if (privateKeyValue.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (privateKeyValue.compareTo(CURVE.getN()) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }

            this.publicKey = new FixedPointCombMultiplier().multiply(CURVE.getG(), privateKeyValue);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString hex-encoded private key (with or without 0x prefix)
     * @return private key instance
     * @throws IllegalArgumentException if hex string is invalid or key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString));
    }

    /**
     * Creates a private key from raw bytes. The input array is zeroed afterwards.
     *
     * @param keyBytes 32-byte private key (will be zeroed after use)
     * @return private key instance
     * @throws IllegalArgumentException if key bytes are invalid
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes);
    }

    /**
     * Derives the account address: the last 20 bytes of the Keccak-256 hash of the
     * uncompressed public key without its {@code 0x04} prefix.
     *
     * @return the address
     * @throws IllegalStateException if the key has been destroyed
     */
    public Address toAddress() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        return addressOf(pubKey);
    }

    /**
     * Signs a 32-byte digest using deterministic ECDSA (RFC 6979).
     *
     * @param messageHash 32-byte digest
     * @return low-s signature with v=0 or v=1
     * @throws IllegalArgumentException if message hash is not 32 bytes
     * @throws IllegalStateException    if the key has been destroyed
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return FastSigner.sign(messageHash, key);
    }

    /**
     * Recovers the signing address from a signature and message hash.
     *
     * @param messageHash 32-byte hash that was signed
     * @param signature   the signature
     * @return recovered address
     * @throws IllegalArgumentException if recovery fails
     */
    public static Address recoverAddress(final byte[] messageHash, final Signature signature) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");

        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes");
        }

        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());
        final int recoveryId = signature.recoveryId();

        final ECPoint publicKey;
        try {
            publicKey = recoverPublicKey(r, s, messageHash, recoveryId);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Failed to recover public key from signature", e);
        }
        if (publicKey == null) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        return addressOf(publicKey);
    }

    private static Address addressOf(final ECPoint pubKey) {
        final byte[] pubKeyBytes = pubKey.getEncoded(false); // 0x04 || x || y
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(pubKeyBytes, 1, pubKeyBytes.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    private static ECPoint recoverPublicKey(
            final BigInteger r,
            final BigInteger s,
            final byte[] messageHash,
            final int recoveryId) {

        if (r.signum() <= 0 || s.signum() <= 0) {
            return null;
        }
        if (r.compareTo(CURVE.getN()) >= 0 || s.compareTo(CURVE.getN()) >= 0) {
            return null;
        }

        // R = (r, y) where y's parity matches recoveryId
        final ECPoint point = decompressKey(r, (recoveryId & 1) == 1);
        if (point == null || !point.multiply(CURVE.getN()).isInfinity()) {
            return null;
        }

        final BigInteger e = new BigInteger(1, messageHash);

        // Q = r^-1 * (s*R - e*G)
        final BigInteger rInv = r.modInverse(CURVE.getN());
        final BigInteger srInv = rInv.multiply(s).mod(CURVE.getN());
        final BigInteger eInv = rInv.multiply(e).mod(CURVE.getN());

        final ECPoint q = point.multiply(srInv).subtract(CURVE.getG().multiply(eInv));
        return q.isInfinity() ? null : q.normalize();
    }

    private static ECPoint decompressKey(final BigInteger x, final boolean yBit) {
        final byte[] encoded = new byte[33];
        encoded[0] = (byte) (yBit ? 0x03 : 0x02);
        final byte[] xBytes = x.toByteArray();
        final int off = xBytes.length > 32 ? 1 : 0;
        System.arraycopy(xBytes, off, encoded, 33 - (xBytes.length - off), xBytes.length - off);
        final ECPoint point = CURVE.getCurve().decodePoint(encoded);
        return point.isValid() ? point : null;
    }

    /**
     * Clears the key references. Subsequent signing or address derivation throws
     * {@link IllegalStateException}.
     */
    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    /**
     * Shows the derived address, never key material.
     */
    @Override
    public String toString() {
        try {
            return "PrivateKey[address=" + toAddress() + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }
}
