// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.did;

import java.util.Objects;

import sh.covenant.core.types.Address;
import sh.covenant.primitives.Base58;

/**
 * Builds address-controlled DIDs that {@link DidValidator} accepts.
 *
 * <pre>{@code
 * String did = DidBuilder.builder()
 *         .method("covenant")
 *         .namespace("agent")
 *         .network("mainnet")
 *         .address(owner)
 *         .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class DidBuilder {

    private String method = "covenant";
    private String namespace = "agent";
    private String network = "mainnet";
    private byte[] header = {0x0d, 0x1d};
    private byte[] trailer = {0x00, 0x00};
    private Address address;

    private DidBuilder() {
    }

    public static DidBuilder builder() {
        return new DidBuilder();
    }

    /** Shortcut for a default-prefixed DID embedding {@code address}. */
    public static String forAddress(final Address address) {
        return builder().address(address).build();
    }

    public DidBuilder method(final String method) {
        this.method = segment(method, "method");
        return this;
    }

    public DidBuilder namespace(final String namespace) {
        this.namespace = segment(namespace, "namespace");
        return this;
    }

    public DidBuilder network(final String network) {
        this.network = segment(network, "network");
        return this;
    }

    /** Two leading bytes of the payload. */
    public DidBuilder header(final byte first, final byte second) {
        this.header = new byte[] {first, second};
        return this;
    }

    /** Two trailing bytes of the payload. */
    public DidBuilder trailer(final byte first, final byte second) {
        this.trailer = new byte[] {first, second};
        return this;
    }

    public DidBuilder address(final Address address) {
        this.address = Objects.requireNonNull(address, "address");
        return this;
    }

    public String build() {
        if (address == null) {
            throw new IllegalStateException("address is required");
        }
        final byte[] payload = new byte[DidValidator.PAYLOAD_LENGTH];
        payload[0] = header[0];
        payload[1] = header[1];
        System.arraycopy(address.toBytes(), 0, payload, DidValidator.ADDRESS_OFFSET, Address.BYTE_LENGTH);
        payload[DidValidator.ADDRESS_END] = trailer[0];
        payload[DidValidator.ADDRESS_END + 1] = trailer[1];
        return "did:" + method + ":" + namespace + ":" + network + ":" + Base58.encode(payload);
    }

    private static String segment(final String value, final String name) {
        Objects.requireNonNull(value, name);
        if (value.isEmpty() || value.indexOf(':') >= 0) {
            throw new IllegalArgumentException(name + " must be non-empty and contain no ':'");
        }
        return value;
    }
}
