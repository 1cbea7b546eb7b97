// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto.eip712;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import sh.covenant.core.error.Eip712Exception;

/**
 * Parser for converting Solidity type strings to {@link Eip712Type} instances.
 * <p>
 * Array types are not supported; none of the registry messages use them.
 */
final class Eip712TypeParser {
    private Eip712TypeParser() {}

    private static final Pattern UINT_PATTERN = Pattern.compile("^uint(\\d*)$");
    private static final Pattern FIXED_BYTES_PATTERN = Pattern.compile("^bytes(\\d+)$");

    /**
     * Parses a Solidity type string into an Eip712Type.
     *
     * @param type  the Solidity type string (e.g., "uint256", "address", "bytes32")
     * @param types the type definitions (for resolving struct types)
     * @return the parsed Eip712Type
     * @throws Eip712Exception if the type is unknown or invalid
     */
    static Eip712Type parse(String type, Map<String, List<TypedDataField>> types) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(types, "types");

        if (type.endsWith("]")) {
            throw Eip712Exception.unsupportedType(type);
        }

        Matcher uintMatch = UINT_PATTERN.matcher(type);
        if (uintMatch.matches()) {
            String bitsStr = uintMatch.group(1);
            int bits = bitsStr.isEmpty() ? 256 : Integer.parseInt(bitsStr);
            try {
                return new Eip712Type.Uint(bits);
            } catch (IllegalArgumentException e) {
                throw Eip712Exception.unknownType(type);
            }
        }

        Matcher fixedBytesMatch = FIXED_BYTES_PATTERN.matcher(type);
        if (fixedBytesMatch.matches()) {
            try {
                return new Eip712Type.FixedBytes(Integer.parseInt(fixedBytesMatch.group(1)));
            } catch (IllegalArgumentException e) {
                throw Eip712Exception.unknownType(type);
            }
        }

        switch (type) {
            case "address":
                return new Eip712Type.Address();
            case "bool":
                return new Eip712Type.Bool();
            case "bytes":
                return new Eip712Type.DynamicBytes();
            case "string":
                return new Eip712Type.String();
            default:
                if (!types.containsKey(type)) {
                    throw Eip712Exception.unknownType(type);
                }
                return new Eip712Type.Struct(type);
        }
    }
}
