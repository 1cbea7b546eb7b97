// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.config;

import static org.junit.jupiter.api.Assertions.*;
import static sh.covenant.registry.Accounts.ALICE;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.covenant.core.crypto.eip712.Eip712Domain;
import sh.covenant.core.error.RegistryError;
import sh.covenant.core.error.RegistryException;
import sh.covenant.core.types.Address;
import sh.covenant.registry.identity.BurnFeePolicy;
import sh.covenant.registry.identity.NonceMode;
import sh.covenant.registry.identity.RegistrationAttempt;
import sh.covenant.registry.identity.RegistrationPolicies;
import sh.covenant.registry.identity.RegistrationPolicy;
import sh.covenant.registry.ledger.Ledger;
import sh.covenant.registry.ledger.ManualClock;

class RegistryConfigTest {

    @Test
    void defaults() {
        RegistryConfig config = RegistryConfig.defaults();

        assertEquals(1L, config.chainId());
        assertEquals("CovenantRegistry", config.domainName());
        assertEquals("1", config.domainVersion());
        assertNull(config.verifyingContract());
        assertEquals(IdentityRequirement.NONE, config.identityRequirement());
        assertEquals(BigInteger.ZERO, config.registrationFee());
        assertEquals(NonceMode.CONSUME_AFTER_EXPIRY_CHECK, config.nonceMode());
        assertTrue(config.burnFeePolicy().isEmpty());
        assertSame(RegistrationPolicies.open(), config.registrationPolicy(null));
    }

    @Test
    void parsesFullDocument() {
        String json = """
            {
              "chainId": 11155111,
              "domainName": "TrustRegistry",
              "domainVersion": "2",
              "verifyingContract": "0x5FbDB2315678afecb367f032d93F642f64180aa3",
              "identityRequirement": "DOMAIN_OR_DID",
              "registrationFee": "1000000000000000000",
              "nonceMode": "CONSUME_ON_SUCCESS"
            }
            """;

        RegistryConfig config = RegistryConfig.fromJson(json);

        assertEquals(11155111L, config.chainId());
        assertEquals("TrustRegistry", config.domainName());
        assertEquals("2", config.domainVersion());
        assertEquals(new Address("0x5fbdb2315678afecb367f032d93f642f64180aa3"), config.verifyingContract());
        assertEquals(IdentityRequirement.DOMAIN_OR_DID, config.identityRequirement());
        assertEquals(new BigInteger("1000000000000000000"), config.registrationFee());
        assertEquals(NonceMode.CONSUME_ON_SUCCESS, config.nonceMode());
    }

    @Test
    void missingKeysTakeDefaultsAndUnknownKeysAreIgnored() {
        RegistryConfig config = RegistryConfig.fromJson("{\"chainId\": 31337, \"operator\": \"ops@example.com\"}");

        assertEquals(RegistryConfig.defaults().toBuilder().chainId(31337L).build(), config);
    }

    @Test
    void rejectsMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> RegistryConfig.fromJson("{ not json"));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> RegistryConfig.fromJson("{\"chainId\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> RegistryConfig.fromJson("{\"registrationFee\": -5}"));
        assertThrows(IllegalArgumentException.class, () -> RegistryConfig.fromJson("{\"verifyingContract\": \"0x12\"}"));
        assertThrows(IllegalArgumentException.class, () -> RegistryConfig.fromJson("{\"nonceMode\": \"SOMETIMES\"}"));
        assertThrows(IllegalArgumentException.class, () -> RegistryConfig.builder().domainName(" ").build());
    }

    @Test
    void eip712DomainMirrorsSettings() {
        Address contract = new Address("0x5fbdb2315678afecb367f032d93f642f64180aa3");
        RegistryConfig config = RegistryConfig.builder().chainId(31337L).verifyingContract(contract).build();

        Eip712Domain domain = config.eip712Domain();

        assertEquals("CovenantRegistry", domain.name());
        assertEquals("1", domain.version());
        assertEquals(31337L, domain.chainId());
        assertEquals(contract, domain.verifyingContract());
        assertNull(domain.salt());
    }

    @Test
    void nonZeroFeeYieldsFreshBurnPolicy() {
        RegistryConfig config = RegistryConfig.builder().registrationFee(BigInteger.TEN).build();

        BurnFeePolicy first = config.burnFeePolicy().orElseThrow();
        assertEquals(BigInteger.TEN, first.fee());
        assertNotSame(first, config.burnFeePolicy().orElseThrow());
    }

    @Test
    void feeIsEnforcedAfterIdentityRequirement() {
        RegistryConfig config = RegistryConfig.builder()
                .identityRequirement(IdentityRequirement.DOMAIN)
                .registrationFee(BigInteger.TEN)
                .build();
        RegistrationPolicy policy = config.registrationPolicy(config.burnFeePolicy().orElseThrow());
        Ledger ledger = new Ledger(new ManualClock(1));
        RegistrationAttempt withDomain = new RegistrationAttempt(ALICE, "a.example", null, false);
        RegistrationAttempt bare = new RegistrationAttempt(ALICE, null, null, false);

        assertEquals(RegistryError.INSUFFICIENT_FEE, rejection(ledger, policy, withDomain, BigInteger.ONE));
        assertEquals(RegistryError.INVALID_INPUT, rejection(ledger, policy, bare, BigInteger.ONE));
        assertDoesNotThrow(() -> check(ledger, policy, withDomain, BigInteger.TEN));
    }

    private static void check(Ledger ledger, RegistrationPolicy policy, RegistrationAttempt attempt, BigInteger value) {
        ledger.execute("check", ALICE, value, tx -> {
            policy.check(attempt, tx);
            return null;
        });
    }

    private static RegistryError rejection(
            Ledger ledger, RegistrationPolicy policy, RegistrationAttempt attempt, BigInteger value) {
        return assertThrows(RegistryException.class, () -> check(ledger, policy, attempt, value)).error();
    }
}
