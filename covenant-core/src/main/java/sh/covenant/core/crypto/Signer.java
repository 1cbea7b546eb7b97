// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto;

import sh.covenant.core.types.Address;

/**
 * A key holder that can sign 32-byte digests.
 * <p>
 * Implementations may keep the key locally, in a KMS or on a hardware wallet.
 */
public interface Signer {

    /**
     * Returns the address associated with this signer.
     *
     * @return the account address
     */
    Address address();

    /**
     * Signs a 32-byte digest as-is, without any message prefix.
     *
     * @param digest the 32-byte digest
     * @return signature with v=0 or v=1
     */
    Signature signHash(byte[] digest);
}
