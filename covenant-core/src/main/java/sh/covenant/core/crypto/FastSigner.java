// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * Deterministic secp256k1 ECDSA signer (RFC 6979).
 * <p>
 * The recovery id is taken from the parity of the nonce point R during signing, so
 * no public key recovery pass is needed. Signatures are normalized to low-s (EIP-2).
 * <p>
 * Thread-safe: each call builds its own {@link HMacDSAKCalculator}, and the shared
 * {@link FixedPointCombMultiplier} holds no mutable state.
 */
public final class FastSigner {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private FastSigner() {
    }

    /**
     * Signs a message hash and returns the signature with recovery ID.
     *
     * @param messageHash 32-byte hash
     * @param privateKey  private key
     * @return Signature with v (0 or 1)
     */
    public static Signature sign(byte[] messageHash, BigInteger privateKey) {
        HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(CURVE.getN(), privateKey, messageHash);

        BigInteger z = new BigInteger(1, messageHash);
        BigInteger r;
        BigInteger s;
        ECPoint p;

        do {
            BigInteger k;
            do {
                k = kCalculator.nextK();
                p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();
                r = p.getAffineXCoord().toBigInteger().mod(CURVE.getN());
            } while (r.signum() == 0);

            // s = k^-1 * (z + r * d) mod n
            s = k.modInverse(CURVE.getN()).multiply(z.add(r.multiply(privateKey))).mod(CURVE.getN());
        } while (s.signum() == 0);

        // y-parity of R
        int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;

        // Low-s: (r, n - s) corresponds to -R, whose y has the opposite parity
        if (s.compareTo(HALF_CURVE_ORDER) > 0) {
            s = CURVE.getN().subtract(s);
            v ^= 1;
        }

        return new Signature(toBytes32(r), toBytes32(s), v);
    }

    private static byte[] toBytes32(BigInteger value) {
        byte[] bytes = value.toByteArray();
        byte[] result = new byte[32];
        if (bytes.length == 32) {
            return bytes;
        } else if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            // drop BigInteger's sign byte
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
