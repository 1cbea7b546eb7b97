// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.agent.event;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.crypto.Keccak256;
import sh.covenant.core.types.Address;
import sh.covenant.core.types.Hash;

class RegistryEventTest {

    private static final Address OWNER = new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
    private static final Hash DATA = new Hash("0x" + "ab".repeat(32));

    private static List<RegistryEvent> samples() {
        return List.of(
            new AgentRegistered(AgentId.of(1), OWNER, "agent.example", null),
            new AgentUpdated(AgentId.of(1), OWNER, null, null, "desc"),
            new AgentDeveloperLinked(AgentId.of(1), "did:a:b:c:d"),
            new FeedbackAuthorized(AgentId.of(1), AgentId.of(2), DATA),
            new ValidationRequested(AgentId.of(1), AgentId.of(2), DATA),
            new ValidationResponded(AgentId.of(1), AgentId.of(2), DATA, 85));
    }

    @Test
    void topicIsKeccakOfSignature() {
        for (RegistryEvent event : samples()) {
            Hash expected = Hash.fromBytes(Keccak256.hash(event.signature().getBytes(StandardCharsets.UTF_8)));
            assertEquals(expected, event.topic(), event.signature());
        }
    }

    @Test
    void topicsAreDistinct() {
        Set<Hash> topics = new HashSet<>();
        for (RegistryEvent event : samples()) {
            assertTrue(topics.add(event.topic()), event.signature());
        }
    }

    @Test
    void canonicalSignatures() {
        assertEquals("AgentRegistered(uint256,address,string,string)", AgentRegistered.SIGNATURE);
        assertEquals("AgentUpdated(uint256,address,string,string,string)", AgentUpdated.SIGNATURE);
        assertEquals("AgentDeveloperLinked(uint256,string)", AgentDeveloperLinked.SIGNATURE);
        assertEquals("FeedbackAuthorized(uint256,uint256,bytes32)", FeedbackAuthorized.SIGNATURE);
        assertEquals("ValidationRequested(uint256,uint256,bytes32)", ValidationRequested.SIGNATURE);
        assertEquals("ValidationResponded(uint256,uint256,bytes32,uint8)", ValidationResponded.SIGNATURE);
    }

    @Test
    void absentStringsAreCarriedAsEmpty() {
        AgentRegistered registered = new AgentRegistered(AgentId.of(3), OWNER, null, null);
        AgentUpdated updated = new AgentUpdated(AgentId.of(3), OWNER, null, null, null);

        assertEquals("", registered.domain());
        assertEquals("", registered.did());
        assertEquals("", updated.description());
    }

    @Test
    void responseMustFitUint8() {
        assertThrows(IllegalArgumentException.class,
            () -> new ValidationResponded(AgentId.of(1), AgentId.of(2), DATA, 256));
        assertThrows(IllegalArgumentException.class,
            () -> new ValidationResponded(AgentId.of(1), AgentId.of(2), DATA, -1));
    }
}
