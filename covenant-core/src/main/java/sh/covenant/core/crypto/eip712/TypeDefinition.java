// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto.eip712;

import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import sh.covenant.core.error.Eip712Exception;

/**
 * Defines the EIP-712 type structure for a Java type.
 *
 * <p>Example for a delegated registration consent:
 * <pre>{@code
 * record Consent(String agentDID, Address agentAddress, BigInteger nonce, BigInteger expiry) {
 *     static final TypeDefinition<Consent> DEFINITION = TypeDefinition.forRecord(
 *         Consent.class,
 *         "Consent",
 *         Map.of("Consent", List.of(
 *             TypedDataField.of("agentDID", "string"),
 *             TypedDataField.of("agentAddress", "address"),
 *             TypedDataField.of("nonce", "uint256"),
 *             TypedDataField.of("expiry", "uint256")
 *         ))
 *     );
 * }
 * }</pre>
 *
 * @param <T> the Java type this definition maps
 * @param primaryType the primary type name
 * @param types map of type names to their field definitions
 * @param extractor function to extract field values from a message object
 */
public record TypeDefinition<T>(
    String primaryType,
    Map<String, List<TypedDataField>> types,
    Function<T, Map<String, Object>> extractor
) {
    public TypeDefinition {
        Objects.requireNonNull(primaryType, "primaryType");
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(extractor, "extractor");
        if (primaryType.isBlank()) {
            throw new IllegalArgumentException("primaryType cannot be blank");
        }
        if (!types.containsKey(primaryType)) {
            throw new IllegalArgumentException("types must contain primaryType: " + primaryType);
        }
    }

    /**
     * Creates a definition for a record type. Record component names must match the
     * field names in the type definition.
     *
     * @param <T> the record type
     * @param recordClass the record class
     * @param primaryType the primary type name for EIP-712 encoding
     * @param types map of type names to their field definitions
     * @return a new TypeDefinition with reflection-based extraction
     * @throws IllegalArgumentException if recordClass is not a record
     */
    public static <T extends Record> TypeDefinition<T> forRecord(
            Class<T> recordClass,
            String primaryType,
            Map<String, List<TypedDataField>> types) {
        Objects.requireNonNull(recordClass, "recordClass");
        if (!recordClass.isRecord()) {
            throw new IllegalArgumentException("Class must be a record: " + recordClass.getName());
        }

        Function<T, Map<String, Object>> extractor = record -> {
            var result = new LinkedHashMap<String, Object>();
            for (RecordComponent component : recordClass.getRecordComponents()) {
                try {
                    var accessor = component.getAccessor();
                    accessor.setAccessible(true);
                    result.put(component.getName(), accessor.invoke(record));
                } catch (ReflectiveOperationException e) {
                    throw new Eip712Exception(
                        "Failed to extract field '" + component.getName() + "' from " + recordClass.getName(), e);
                }
            }
            return result;
        };

        return new TypeDefinition<>(primaryType, types, extractor);
    }
}
