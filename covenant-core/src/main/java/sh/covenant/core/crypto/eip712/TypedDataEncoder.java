// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto.eip712;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sh.covenant.core.crypto.Keccak256;
import sh.covenant.core.error.Eip712Exception;
import sh.covenant.core.types.Address;
import sh.covenant.core.types.Hash;
import sh.covenant.primitives.Hex;

/**
 * Internal encoder for EIP-712 typed data structures.
 * <ul>
 *   <li>{@link #encodeType} - canonical type string encoding</li>
 *   <li>{@link #typeHash} - keccak256 of the encoded type</li>
 *   <li>{@link #encodeData} - field value encoding</li>
 *   <li>{@link #hashStruct} - complete struct hashing</li>
 *   <li>{@link #hashDomain} - domain separator computation</li>
 * </ul>
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
final class TypedDataEncoder {
    private TypedDataEncoder() {}

    // ═══════════════════════════════════════════════════════════════
    // TYPE ENCODING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Encodes a type definition to its canonical string form, primary type first and
     * referenced struct types after it in alphabetical order.
     * Example: "Mail(Person from,Person to,string contents)Person(string name,address wallet)"
     */
    static String encodeType(
            String typeName,
            Map<String, List<TypedDataField>> types) {

        Set<String> allDeps = new LinkedHashSet<>();
        collectDependencies(typeName, types, allDeps, new HashSet<>());

        List<String> sortedTypes = new ArrayList<>();
        sortedTypes.add(typeName);
        allDeps.remove(typeName);
        allDeps.stream().sorted().forEach(sortedTypes::add);

        var result = new StringBuilder();
        for (String t : sortedTypes) {
            var fields = types.get(t);
            result.append(t).append('(');
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) result.append(',');
                result.append(fields.get(i).type()).append(' ').append(fields.get(i).name());
            }
            result.append(')');
        }
        return result.toString();
    }

    private static void collectDependencies(
            String typeName,
            Map<String, List<TypedDataField>> types,
            Set<String> deps,
            Set<String> visiting) {

        if (visiting.contains(typeName)) {
            throw Eip712Exception.cyclicDependency(typeName);
        }

        var fields = types.get(typeName);
        if (fields == null) {
            return;
        }

        deps.add(typeName);
        visiting.add(typeName);
        for (var field : fields) {
            if (types.containsKey(field.type())) {
                collectDependencies(field.type(), types, deps, visiting);
            }
        }
        visiting.remove(typeName);
    }

    /**
     * Computes typeHash = keccak256(encodeType(typeName))
     */
    static byte[] typeHash(
            String typeName,
            Map<String, List<TypedDataField>> types) {
        return Keccak256.hash(encodeType(typeName, types).getBytes(StandardCharsets.UTF_8));
    }

    // ═══════════════════════════════════════════════════════════════
    // DATA ENCODING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Encodes struct data as concatenated 32-byte words, one per field.
     */
    static byte[] encodeData(
            String typeName,
            Map<String, List<TypedDataField>> types,
            Map<String, Object> data) {
        var fields = types.get(typeName);
        if (fields == null) {
            throw Eip712Exception.primaryTypeNotFound(typeName);
        }
        var encoded = new ByteArrayOutputStream();

        for (var field : fields) {
            if (!data.containsKey(field.name())) {
                throw Eip712Exception.missingField(typeName, field.name());
            }
            encoded.writeBytes(encodeField(field.type(), data.get(field.name()), types));
        }

        return encoded.toByteArray();
    }

    static byte[] encodeField(
            String type,
            Object value,
            Map<String, List<TypedDataField>> types) {
        if (value == null) {
            throw Eip712Exception.invalidValue(type, null);
        }
        Eip712Type parsedType = Eip712TypeParser.parse(type, types);
        if (parsedType instanceof Eip712Type.Uint u) {
            return encodeUint(value, u.bits());
        } else if (parsedType instanceof Eip712Type.Address) {
            return padLeft(toAddress(value).toBytes());
        } else if (parsedType instanceof Eip712Type.Bool) {
            byte[] result = new byte[32];
            result[31] = (byte) (toBoolean(value) ? 1 : 0);
            return result;
        } else if (parsedType instanceof Eip712Type.FixedBytes fb) {
            return encodeFixedBytes(value, fb.length());
        } else if (parsedType instanceof Eip712Type.DynamicBytes) {
            return Keccak256.hash(toBytes(value));
        } else if (parsedType instanceof Eip712Type.String) {
            return encodeString(value);
        } else {
            return hashStruct(((Eip712Type.Struct) parsedType).name(), types, asMap(value));
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // STRUCT HASHING
    // ═══════════════════════════════════════════════════════════════

    /**
     * hashStruct(s) = keccak256(typeHash || encodeData(s))
     */
    static byte[] hashStruct(
            String typeName,
            Map<String, List<TypedDataField>> types,
            Map<String, Object> data) {
        return Keccak256.hash(typeHash(typeName, types), encodeData(typeName, types, data));
    }

    // ═══════════════════════════════════════════════════════════════
    // DOMAIN HASHING
    // ═══════════════════════════════════════════════════════════════

    static Hash hashDomain(Eip712Domain domain) {
        var fields = new ArrayList<TypedDataField>();
        var data = new LinkedHashMap<String, Object>();
        if (domain.name() != null) {
            fields.add(TypedDataField.of("name", "string"));
            data.put("name", domain.name());
        }
        if (domain.version() != null) {
            fields.add(TypedDataField.of("version", "string"));
            data.put("version", domain.version());
        }
        if (domain.chainId() != null) {
            fields.add(TypedDataField.of("chainId", "uint256"));
            data.put("chainId", BigInteger.valueOf(domain.chainId()));
        }
        if (domain.verifyingContract() != null) {
            fields.add(TypedDataField.of("verifyingContract", "address"));
            data.put("verifyingContract", domain.verifyingContract());
        }
        if (domain.salt() != null) {
            fields.add(TypedDataField.of("salt", "bytes32"));
            data.put("salt", domain.salt());
        }
        return Hash.fromBytes(hashStruct("EIP712Domain", Map.of("EIP712Domain", fields), data));
    }

    // ═══════════════════════════════════════════════════════════════
    // PRIMITIVE ENCODING
    // ═══════════════════════════════════════════════════════════════

    private static byte[] encodeUint(Object value, int bits) {
        BigInteger bi = toBigInteger(value);
        if (bi.signum() < 0) {
            throw Eip712Exception.invalidValue("uint" + bits, "cannot be negative: " + bi);
        }
        if (bi.bitLength() > bits) {
            throw Eip712Exception.valueOutOfRange("uint" + bits, bi, "exceeds " + bits + " bits");
        }
        byte[] raw = bi.toByteArray();
        // strip BigInteger's sign byte
        if (raw.length > 32) {
            byte[] trimmed = new byte[32];
            System.arraycopy(raw, raw.length - 32, trimmed, 0, 32);
            return trimmed;
        }
        return padLeft(raw);
    }

    private static byte[] encodeFixedBytes(Object value, int length) {
        byte[] bytes = toBytes(value);
        if (bytes.length != length) {
            throw Eip712Exception.invalidValue("bytes" + length, "expected " + length + " bytes, got " + bytes.length);
        }
        byte[] result = new byte[32];
        System.arraycopy(bytes, 0, result, 0, bytes.length);
        return result;
    }

    private static byte[] encodeString(Object value) {
        if (!(value instanceof String str)) {
            throw Eip712Exception.invalidValue("string", value);
        }
        return Keccak256.hash(str.getBytes(StandardCharsets.UTF_8));
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPER METHODS
    // ═══════════════════════════════════════════════════════════════

    private static BigInteger toBigInteger(Object value) {
        if (value instanceof BigInteger bi) {
            return bi;
        } else if (value instanceof Long l) {
            return BigInteger.valueOf(l);
        } else if (value instanceof Integer i) {
            return BigInteger.valueOf(i);
        } else if (value instanceof String s) {
            if (Hex.hasPrefix(s)) {
                return new BigInteger(s.substring(2), 16);
            }
            return new BigInteger(s);
        }
        throw Eip712Exception.invalidValue("integer", value);
    }

    private static Address toAddress(Object value) {
        if (value instanceof Address addr) {
            return addr;
        } else if (value instanceof String s) {
            return new Address(s);
        }
        throw Eip712Exception.invalidValue("address", value);
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw Eip712Exception.invalidValue("bool", value);
    }

    private static byte[] toBytes(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes;
        } else if (value instanceof Hash hash) {
            return hash.toBytes();
        } else if (value instanceof String s) {
            return Hex.decode(s);
        }
        throw Eip712Exception.invalidValue("bytes", value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw Eip712Exception.invalidValue("struct", value);
    }

    private static byte[] padLeft(byte[] bytes) {
        if (bytes.length >= 32) {
            return bytes;
        }
        byte[] result = new byte[32];
        System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        return result;
    }
}
