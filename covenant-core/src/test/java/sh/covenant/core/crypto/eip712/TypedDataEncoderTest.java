// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.crypto.eip712;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.covenant.core.error.Eip712Exception;
import sh.covenant.core.types.Address;
import sh.covenant.core.types.Hash;
import sh.covenant.primitives.Hex;

/**
 * Vectors are the "Mail" example from
 * <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>.
 */
class TypedDataEncoderTest {

    // ═══════════════════════════════════════════════════════════════
    // Fixtures
    // ═══════════════════════════════════════════════════════════════

    static final Map<String, List<TypedDataField>> MAIL_TYPES = new LinkedHashMap<>();
    static {
        MAIL_TYPES.put("Mail", List.of(
            TypedDataField.of("from", "Person"),
            TypedDataField.of("to", "Person"),
            TypedDataField.of("contents", "string")
        ));
        MAIL_TYPES.put("Person", List.of(
            TypedDataField.of("name", "string"),
            TypedDataField.of("wallet", "address")
        ));
    }

    static final Eip712Domain MAIL_DOMAIN = Eip712Domain.builder()
        .name("Ether Mail")
        .version("1")
        .chainId(1L)
        .verifyingContract(new Address("0xCcCCccccCCCCcCCCCCCcCcCccCcCCCcCcccccccC"))
        .build();

    static Map<String, Object> mailMessage() {
        var message = new LinkedHashMap<String, Object>();
        message.put("from", Map.of("name", "Cow", "wallet", "0xCD2a3d9F938E13CD947Ec05AbC7FE734Df8DD826"));
        message.put("to", Map.of("name", "Bob", "wallet", "0xbBbBBBBbbBBBbbbBbbBbbbbBBbBbbbbBbBbbBBbB"));
        message.put("contents", "Hello, Bob!");
        return message;
    }

    // ═══════════════════════════════════════════════════════════════
    // encodeType / typeHash
    // ═══════════════════════════════════════════════════════════════

    @Test
    void encodeType_mailExample() {
        assertEquals(
            "Mail(Person from,Person to,string contents)Person(string name,address wallet)",
            TypedDataEncoder.encodeType("Mail", MAIL_TYPES));
    }

    @Test
    void encodeType_dependencyAsPrimary() {
        assertEquals("Person(string name,address wallet)", TypedDataEncoder.encodeType("Person", MAIL_TYPES));
    }

    @Test
    void encodeType_dependenciesSortedAlphabetically() {
        var types = new LinkedHashMap<String, List<TypedDataField>>();
        types.put("Root", List.of(TypedDataField.of("zeta", "Zeta"), TypedDataField.of("alpha", "Alpha")));
        types.put("Zeta", List.of(TypedDataField.of("value", "uint256")));
        types.put("Alpha", List.of(TypedDataField.of("value", "string")));

        assertEquals(
            "Root(Zeta zeta,Alpha alpha)Alpha(string value)Zeta(uint256 value)",
            TypedDataEncoder.encodeType("Root", types));
    }

    @Test
    void encodeType_selfReferenceIsRejected() {
        var types = Map.of("Node", List.of(TypedDataField.of("next", "Node")));
        assertThrows(Eip712Exception.class, () -> TypedDataEncoder.encodeType("Node", types));
    }

    @Test
    void typeHash_mailExample() {
        assertEquals(
            "0xa0cedeb2dc280ba39b857546d74f5549c3a1d7bdc2dd96bf881f76108e23dac2",
            Hex.encode(TypedDataEncoder.typeHash("Mail", MAIL_TYPES)));
    }

    // ═══════════════════════════════════════════════════════════════
    // hashDomain / hashStruct
    // ═══════════════════════════════════════════════════════════════

    @Test
    void hashDomain_mailExample() {
        assertEquals(
            new Hash("0xf2cee375fa42b42143804025fc449deafd50cc031ca257e0b194a650a912090f"),
            TypedDataEncoder.hashDomain(MAIL_DOMAIN));
        assertEquals(TypedDataEncoder.hashDomain(MAIL_DOMAIN), MAIL_DOMAIN.separator());
    }

    @Test
    void hashStruct_mailExample() {
        assertEquals(
            "0xc52c0ee5d84264471806290a3f2c4cecfc5490626bf912d01f240d7a274b371e",
            Hex.encode(TypedDataEncoder.hashStruct("Mail", MAIL_TYPES, mailMessage())));
    }

    @Test
    void hashDomain_changesWithChainId() {
        Eip712Domain other = Eip712Domain.builder()
            .name("Ether Mail")
            .version("1")
            .chainId(5L)
            .verifyingContract(new Address("0xCcCCccccCCCCcCCCCCCcCcCccCcCCCcCcccccccC"))
            .build();
        assertNotEquals(MAIL_DOMAIN.separator(), other.separator());
    }

    // ═══════════════════════════════════════════════════════════════
    // encodeField
    // ═══════════════════════════════════════════════════════════════

    @Test
    void encodeField_uintIsLeftPadded() {
        byte[] word = TypedDataEncoder.encodeField("uint256", BigInteger.valueOf(0x0102), Map.of());
        assertEquals(32, word.length);
        assertEquals(0x01, word[30]);
        assertEquals(0x02, word[31]);
    }

    @Test
    void encodeField_maxUint256() {
        BigInteger max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);
        byte[] word = TypedDataEncoder.encodeField("uint256", max, Map.of());
        assertEquals(32, word.length);
        for (byte b : word) {
            assertEquals((byte) 0xff, b);
        }
    }

    @Test
    void encodeField_rejectsNegativeAndOverflow() {
        assertThrows(Eip712Exception.class,
            () -> TypedDataEncoder.encodeField("uint256", BigInteger.valueOf(-1), Map.of()));
        assertThrows(Eip712Exception.class,
            () -> TypedDataEncoder.encodeField("uint8", 256, Map.of()));
    }

    @Test
    void encodeField_fixedBytesAreRightPadded() {
        byte[] word = TypedDataEncoder.encodeField("bytes2", new byte[] {0x12, 0x34}, Map.of());
        assertEquals(0x12, word[0]);
        assertEquals(0x34, word[1]);
        assertEquals(0, word[31]);
    }

    @Test
    void encodeField_rejectsWrongValueTypes() {
        assertThrows(Eip712Exception.class, () -> TypedDataEncoder.encodeField("string", 42, Map.of()));
        assertThrows(Eip712Exception.class, () -> TypedDataEncoder.encodeField("bool", "yes", Map.of()));
        assertThrows(Eip712Exception.class, () -> TypedDataEncoder.encodeField("address", 1L, Map.of()));
        assertThrows(Eip712Exception.class, () -> TypedDataEncoder.encodeField("uint256", null, Map.of()));
    }

    @Test
    void encodeData_missingFieldIsReported() {
        var message = new LinkedHashMap<>(mailMessage());
        message.remove("contents");

        Eip712Exception ex = assertThrows(Eip712Exception.class,
            () -> TypedDataEncoder.encodeData("Mail", MAIL_TYPES, message));
        assertTrue(ex.getMessage().contains("contents"));
    }

    @Test
    void encodeData_unknownPrimaryType() {
        assertThrows(Eip712Exception.class,
            () -> TypedDataEncoder.encodeData("Letter", MAIL_TYPES, mailMessage()));
    }
}
