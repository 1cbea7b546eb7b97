// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.did;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.covenant.core.types.Address;
import sh.covenant.primitives.Base58;

class DidValidatorTest {

    private static final Address OWNER = new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
    private static final Address OTHER = new Address("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");

    private static byte[] payloadFor(Address address) {
        byte[] payload = new byte[DidValidator.PAYLOAD_LENGTH];
        payload[0] = 0x0d;
        payload[1] = 0x1d;
        System.arraycopy(address.toBytes(), 0, payload, 9, 20);
        payload[29] = 0x4a;
        payload[30] = 0x7f;
        return payload;
    }

    private static String didWithPayload(byte[] payload) {
        return "did:covenant:agent:mainnet:" + Base58.encode(payload);
    }

    // ═══════════════════════════════════════════════════════════════
    // Binding
    // ═══════════════════════════════════════════════════════════════

    @Test
    void validatesEmbeddedAddress() {
        String did = didWithPayload(payloadFor(OWNER));

        assertTrue(DidValidator.validate(did, OWNER));
        assertFalse(DidValidator.validate(did, OTHER));
        assertEquals(Optional.of(OWNER), DidValidator.extractAddress(did));
    }

    @Test
    void builderProducesValidDid() {
        String did = DidBuilder.forAddress(OTHER);

        assertTrue(did.startsWith("did:covenant:agent:mainnet:"));
        assertTrue(DidValidator.validate(did, OTHER));
        assertFalse(DidValidator.validate(did, OWNER));
    }

    @Test
    void builderWithCustomSegmentsAndZeroHeader() {
        String did = DidBuilder.builder()
            .method("key")
            .namespace("dev")
            .network("testnet")
            .header((byte) 0, (byte) 0)
            .trailer((byte) 1, (byte) 2)
            .address(OWNER)
            .build();

        assertTrue(did.startsWith("did:key:dev:testnet:1"));
        assertTrue(DidValidator.validate(did, OWNER));
    }

    @Test
    void prefixSegmentsAreNotInterpreted() {
        String payload = Base58.encode(payloadFor(OWNER));
        assertTrue(DidValidator.validate("a:b:c:d:" + payload, OWNER));
        assertTrue(DidValidator.validate("::::" + payload, OWNER));
    }

    // ═══════════════════════════════════════════════════════════════
    // Layout
    // ═══════════════════════════════════════════════════════════════

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5, 6, 7, 8})
    void nonZeroPaddingByteFails(int index) {
        byte[] payload = payloadFor(OWNER);
        payload[index] = 1;
        assertFalse(DidValidator.validate(didWithPayload(payload), OWNER));
        assertTrue(DidValidator.extractAddress(didWithPayload(payload)).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 20, 29, 30, 32, 40})
    void wrongPayloadLengthFails(int length) {
        byte[] payload = new byte[length];
        if (length > 0) {
            payload[0] = 0x0d;
        }
        if (length >= 29) {
            System.arraycopy(OWNER.toBytes(), 0, payload, 9, 20);
        }
        assertFalse(DidValidator.validate(didWithPayload(payload), OWNER));
    }

    @Test
    void trailingBytesOutsideAddressAreIgnored() {
        byte[] a = payloadFor(OWNER);
        byte[] b = payloadFor(OWNER);
        b[29] = (byte) 0xff;
        b[30] = (byte) 0xee;
        assertTrue(DidValidator.validate(didWithPayload(a), OWNER));
        assertTrue(DidValidator.validate(didWithPayload(b), OWNER));
    }

    // ═══════════════════════════════════════════════════════════════
    // Malformed text
    // ═══════════════════════════════════════════════════════════════

    @Test
    void wrongSeparatorCountFails() {
        String payload = Base58.encode(payloadFor(OWNER));
        assertFalse(DidValidator.validate("did:covenant:mainnet:" + payload, OWNER));
        assertFalse(DidValidator.validate("did:covenant:agent:mainnet:extra:" + payload, OWNER));
        assertFalse(DidValidator.validate(payload, OWNER));
    }

    @Test
    void invalidBase58SymbolFails() {
        String payload = Base58.encode(payloadFor(OWNER));
        String corrupted = payload.substring(0, 5) + "0" + payload.substring(6);
        assertFalse(DidValidator.validate("did:covenant:agent:mainnet:" + corrupted, OWNER));
    }

    @Test
    void overflowingPayloadFails() {
        assertFalse(DidValidator.validate("did:covenant:agent:mainnet:" + "z".repeat(120), OWNER));
    }

    @Test
    void nullAndEmptyDidFail() {
        assertFalse(DidValidator.validate(null, OWNER));
        assertFalse(DidValidator.validate("", OWNER));
        assertFalse(DidValidator.validate("did:covenant:agent:mainnet:", OWNER));
        assertThrows(NullPointerException.class, () -> DidValidator.validate("did:a:b:c:d", null));
    }

    @Test
    void builderRejectsBadSegments() {
        assertThrows(IllegalArgumentException.class, () -> DidBuilder.builder().method("a:b"));
        assertThrows(IllegalArgumentException.class, () -> DidBuilder.builder().network(""));
        assertThrows(IllegalStateException.class, () -> DidBuilder.builder().build());
    }
}
