// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.validation;

import static org.junit.jupiter.api.Assertions.*;
import static sh.covenant.registry.Accounts.ALICE;
import static sh.covenant.registry.Accounts.BOB;
import static sh.covenant.registry.Accounts.CAROL;
import static sh.covenant.registry.Accounts.DAVE;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.agent.event.ValidationRequested;
import sh.covenant.core.agent.event.ValidationResponded;
import sh.covenant.core.crypto.eip712.Eip712Domain;
import sh.covenant.core.error.RegistryError;
import sh.covenant.core.error.RegistryException;
import sh.covenant.core.types.Address;
import sh.covenant.core.types.Hash;
import sh.covenant.registry.Accounts;
import sh.covenant.registry.identity.AgentUpdate;
import sh.covenant.registry.identity.IdentityRegistry;
import sh.covenant.registry.identity.NonceMode;
import sh.covenant.registry.identity.RegistrationPolicies;
import sh.covenant.registry.ledger.Ledger;
import sh.covenant.registry.ledger.ManualClock;

class ValidationRegistryTest {

    private static final Hash DATA = Accounts.dataHash("report-v1");

    private ManualClock clock;
    private Ledger ledger;
    private IdentityRegistry identity;
    private ValidationRegistry validation;

    private AgentId server;
    private AgentId validator;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(10_000);
        ledger = new Ledger(clock);
        identity = new IdentityRegistry(ledger, RegistrationPolicies.open(),
                Eip712Domain.builder().name("CovenantRegistry").version("1").chainId(1L).build(),
                NonceMode.CONSUME_AFTER_EXPIRY_CHECK);
        validation = new ValidationRegistry(ledger, identity);

        server = register(ALICE, "server.example");
        validator = register(BOB, "validator.example");
    }

    private AgentId register(Address owner, String domain) {
        return ledger.execute("register", owner, tx -> identity.register(tx, domain, null, owner, null));
    }

    private ValidationRequest request(Address sender, AgentId validatorId, AgentId serverId, Hash dataHash) {
        return ledger.execute("requestValidation", sender,
                tx -> validation.requestValidation(tx, validatorId, serverId, dataHash));
    }

    private void respond(Address sender, Hash dataHash, int score) {
        ledger.execute("submitResponse", sender, tx -> {
            validation.submitResponse(tx, dataHash, score);
            return null;
        });
    }

    private RegistryError responseRejection(Address sender, Hash dataHash, int score) {
        return assertThrows(RegistryException.class, () -> respond(sender, dataHash, score)).error();
    }

    @Test
    void anyoneMayRequestValidation() {
        ValidationRequest created = request(CAROL, validator, server, DATA);

        assertEquals(validator, created.validatorAgentId());
        assertEquals(server, created.serverAgentId());
        assertEquals(10_000, created.timestamp());
        assertFalse(created.responded());
        assertEquals(created, validation.getRequest(DATA));
        assertEquals(ValidationState.PENDING, validation.stateOf(DATA));
        assertEquals(new PendingStatus(true, true), validation.isPending(DATA));
    }

    @Test
    void requestRejectsZeroHashAndUnknownAgents() {
        RegistryException zero = assertThrows(RegistryException.class, () -> request(ALICE, validator, server, Hash.ZERO));
        assertEquals(RegistryError.INVALID_DATA_HASH, zero.error());

        RegistryException missingValidator = assertThrows(RegistryException.class,
                () -> request(ALICE, AgentId.of(99), server, DATA));
        assertEquals(RegistryError.AGENT_NOT_FOUND, missingValidator.error());

        RegistryException missingServer = assertThrows(RegistryException.class,
                () -> request(ALICE, validator, AgentId.of(99), DATA));
        assertEquals(RegistryError.AGENT_NOT_FOUND, missingServer.error());

        assertEquals(ValidationState.ABSENT, validation.stateOf(DATA));
    }

    @Test
    void repeatedRequestIsIdempotentButReEmits() {
        ValidationRequest first = request(ALICE, validator, server, DATA);
        clock.advance(10);
        AgentId other = register(CAROL, "other.example");
        ValidationRequest second = request(DAVE, other, server, DATA);

        assertEquals(first, second);
        assertEquals(validator, validation.getRequest(DATA).validatorAgentId());
        assertEquals(List.of(
                new ValidationRequested(validator, server, DATA),
                new ValidationRequested(other, server, DATA)),
                ledger.eventLog().ofType(ValidationRequested.class));
    }

    @Test
    void validatorOwnerResponds() {
        request(ALICE, validator, server, DATA);

        respond(BOB, DATA, 87);

        assertEquals(new ResponseStatus(true, 87), validation.getResponse(DATA));
        assertEquals(ValidationState.RESPONDED, validation.stateOf(DATA));
        assertEquals(new PendingStatus(true, false), validation.isPending(DATA));
        assertEquals(List.of(new ValidationResponded(validator, server, DATA, 87)),
                ledger.eventLog().ofType(ValidationResponded.class));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 100})
    void acceptsBoundaryScores(int score) {
        request(ALICE, validator, server, DATA);
        respond(BOB, DATA, score);
        assertEquals(score, validation.getResponse(DATA).score());
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 101, 255})
    void rejectsOutOfRangeScores(int score) {
        request(ALICE, validator, server, DATA);
        assertEquals(RegistryError.INVALID_RESPONSE, responseRejection(BOB, DATA, score));
        assertFalse(validation.getResponse(DATA).hasResponse());
    }

    @Test
    void scoreRangeIsCheckedBeforeExistence() {
        assertEquals(RegistryError.INVALID_RESPONSE, responseRejection(BOB, DATA, 101));
        assertEquals(RegistryError.VALIDATION_REQUEST_NOT_FOUND, responseRejection(BOB, DATA, 50));
    }

    @Test
    void onlyDesignatedValidatorMayRespond() {
        request(ALICE, validator, server, DATA);

        assertEquals(RegistryError.UNAUTHORIZED_VALIDATOR, responseRejection(ALICE, DATA, 50));
        assertEquals(ValidationState.PENDING, validation.stateOf(DATA));
    }

    @Test
    void respondingTwiceIsRejected() {
        request(ALICE, validator, server, DATA);
        respond(BOB, DATA, 50);

        assertEquals(RegistryError.VALIDATION_ALREADY_RESPONDED, responseRejection(BOB, DATA, 60));
        assertEquals(50, validation.getResponse(DATA).score());
    }

    @Test
    void requestExpiresAfterWindow() {
        request(ALICE, validator, server, DATA);

        clock.advance(ValidationRegistry.EXPIRATION_WINDOW);
        assertEquals(ValidationState.PENDING, validation.stateOf(DATA));

        clock.advance(1);
        assertEquals(ValidationState.EXPIRED, validation.stateOf(DATA));
        assertEquals(new PendingStatus(true, false), validation.isPending(DATA));
        assertEquals(RegistryError.REQUEST_EXPIRED, responseRejection(BOB, DATA, 50));
    }

    @Test
    void responseAtLastValidTimeIsAccepted() {
        request(ALICE, validator, server, DATA);
        clock.advance(ValidationRegistry.EXPIRATION_WINDOW);

        respond(BOB, DATA, 42);

        assertEquals(42, validation.getResponse(DATA).score());
    }

    @Test
    void expiredSlotIsReusableByAnotherValidator() {
        ValidationRequest first = request(ALICE, validator, server, DATA);
        clock.advance(ValidationRegistry.EXPIRATION_WINDOW + 1);
        AgentId other = register(CAROL, "other.example");

        ValidationRequest second = request(ALICE, other, server, DATA);

        assertNotEquals(first, second);
        assertEquals(other, validation.getRequest(DATA).validatorAgentId());
        assertEquals(ValidationState.PENDING, validation.stateOf(DATA));
        assertEquals(RegistryError.UNAUTHORIZED_VALIDATOR, responseRejection(BOB, DATA, 10));
        respond(CAROL, DATA, 10);
        assertEquals(10, validation.getResponse(DATA).score());
    }

    @Test
    void reusedSlotDropsEarlierScore() {
        request(ALICE, validator, server, DATA);
        respond(BOB, DATA, 70);
        clock.advance(ValidationRegistry.EXPIRATION_WINDOW + 1);
        AgentId other = register(CAROL, "other.example");

        request(ALICE, other, server, DATA);

        assertEquals(new PendingStatus(true, true), validation.isPending(DATA));
        assertEquals(new ResponseStatus(false, 0), validation.getResponse(DATA));
        respond(CAROL, DATA, 30);
        assertEquals(new ResponseStatus(true, 30), validation.getResponse(DATA));
    }

    @Test
    void validatorAuthorityFollowsAddressRotation() {
        request(ALICE, validator, server, DATA);
        ledger.execute("updateAgent", BOB,
                tx -> identity.updateAgent(tx, validator, AgentUpdate.builder().newAddress(DAVE).build()));

        assertEquals(RegistryError.UNAUTHORIZED_VALIDATOR, responseRejection(BOB, DATA, 50));
        respond(DAVE, DATA, 50);
        assertEquals(ValidationState.RESPONDED, validation.stateOf(DATA));
    }

    @Test
    void unknownHashReadsAsAbsent() {
        Hash unknown = Accounts.dataHash("unknown");

        assertEquals(ValidationState.ABSENT, validation.stateOf(unknown));
        assertEquals(new PendingStatus(false, false), validation.isPending(unknown));
        assertEquals(new ResponseStatus(false, 0), validation.getResponse(unknown));
        RegistryException e = assertThrows(RegistryException.class, () -> validation.getRequest(unknown));
        assertEquals(RegistryError.VALIDATION_REQUEST_NOT_FOUND, e.error());
    }
}
