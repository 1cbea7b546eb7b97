// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.ledger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;
import static sh.covenant.registry.Accounts.ALICE;
import static sh.covenant.registry.Accounts.BOB;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.covenant.core.agent.AgentId;
import sh.covenant.core.agent.event.AgentDeveloperLinked;
import sh.covenant.core.agent.event.AgentRegistered;
import sh.covenant.core.agent.event.RegistryEvent;
import sh.covenant.core.error.RegistryError;
import sh.covenant.core.error.RegistryException;
import sh.covenant.registry.Accounts;

class LedgerTest {

    private static final RegistryEvent LINKED = new AgentDeveloperLinked(AgentId.of(1), "did:covenant:dev:x");

    private ManualClock clock;
    private Ledger ledger;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(100);
        ledger = new Ledger(clock, () -> Accounts.fixedSeed(7));
    }

    @Test
    void transactionCarriesSenderTimeValueAndSeed() {
        Transaction seen = ledger.execute("inspect", ALICE, BigInteger.TEN, tx -> tx);

        assertEquals(1, seen.sequence());
        assertEquals("inspect", seen.operation());
        assertEquals(ALICE, seen.sender());
        assertEquals(BigInteger.TEN, seen.value());
        assertEquals(100, seen.timestamp());
        assertArrayEquals(Accounts.fixedSeed(7), seen.seed());
    }

    @Test
    void sequenceCountsRejectedTransactions() {
        ledger.execute("ok", ALICE, tx -> null);
        assertThrows(RegistryException.class, () -> ledger.execute("fail", ALICE, tx -> {
            throw RegistryException.of(RegistryError.INVALID_INPUT, "no");
        }));
        long third = ledger.execute("ok", ALICE, Transaction::sequence);

        assertEquals(3, third);
        assertEquals(3, ledger.lastSequence());
    }

    @Test
    void eventsCommitOnlyWhenBodySucceeds() {
        ledger.execute("commit", ALICE, tx -> {
            tx.emit(LINKED);
            return null;
        });
        assertThrows(RegistryException.class, () -> ledger.execute("revert", ALICE, tx -> {
            tx.emit(LINKED);
            throw RegistryException.of(RegistryError.AGENT_NOT_FOUND, "gone");
        }));
        assertThrows(IllegalStateException.class, () -> ledger.execute("boom", ALICE, tx -> {
            tx.emit(LINKED);
            throw new IllegalStateException("boom");
        }));

        assertEquals(List.of(LINKED), ledger.eventLog().all());
    }

    @Test
    void rejectsClockGoingBackwards() {
        ledger.execute("first", ALICE, tx -> null);
        clock.set(99);

        assertThrows(IllegalStateException.class, () -> ledger.execute("second", ALICE, tx -> null));
        assertEquals(1, ledger.lastSequence());
    }

    @Test
    void sameTimestampIsAllowed() {
        ledger.execute("first", ALICE, tx -> null);
        long timestamp = ledger.execute("second", BOB, Transaction::timestamp);
        assertEquals(100, timestamp);
    }

    @Test
    void rejectsNegativeValue() {
        assertThrows(IllegalArgumentException.class,
                () -> ledger.execute("pay", ALICE, BigInteger.valueOf(-1), tx -> null));
    }

    @Test
    void rejectsShortSeed() {
        Ledger broken = new Ledger(clock, () -> new byte[4]);
        assertThrows(IllegalStateException.class, () -> broken.execute("x", ALICE, tx -> null));
    }

    @Test
    void transactionIsUnusableAfterBody() {
        AtomicReference<Transaction> leaked = new AtomicReference<>();
        ledger.execute("leak", ALICE, tx -> {
            leaked.set(tx);
            return null;
        });

        assertThrows(IllegalStateException.class, () -> leaked.get().emit(LINKED));
        assertThrows(IllegalStateException.class, () -> leaked.get().requireActiveOn(ledger));
    }

    @Test
    void transactionIsBoundToItsLedger() {
        Ledger other = new Ledger(clock);
        ledger.execute("cross", ALICE, tx -> {
            assertThrows(IllegalStateException.class, () -> tx.requireActiveOn(other));
            return null;
        });
    }

    @Test
    void nowNeverRunsBehindLastTransaction() {
        ledger.execute("t", ALICE, tx -> null);
        assertEquals(100, ledger.now());
        clock.advance(5);
        assertEquals(105, ledger.now());
    }

    @Test
    void readsAreAllowedInsideWrites() {
        int result = ledger.execute("nested", ALICE, tx -> ledger.read(() -> 42));
        assertEquals(42, result);
    }

    @Test
    void listenersReceiveCommittedEvents() {
        EventListener listener = mock(EventListener.class);
        ledger.eventLog().subscribe(listener);

        ledger.execute("emit", ALICE, tx -> {
            tx.emit(LINKED);
            return null;
        });
        assertThrows(RegistryException.class, () -> ledger.execute("revert", ALICE, tx -> {
            tx.emit(LINKED);
            throw RegistryException.of(RegistryError.INVALID_INPUT, "no");
        }));

        verify(listener).onEvent(1L, LINKED);
        verifyNoMoreInteractions(listener);

        assertTrue(ledger.eventLog().unsubscribe(listener));
        assertFalse(ledger.eventLog().unsubscribe(listener));
    }

    @Test
    void failingListenerIsLoggedAndOthersStillRun() {
        Logger logger = (Logger) LoggerFactory.getLogger(EventLog.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            EventListener failing = mock(EventListener.class);
            doThrow(new IllegalStateException("listener broke")).when(failing).onEvent(anyLong(), any());
            EventListener healthy = mock(EventListener.class);
            ledger.eventLog().subscribe(failing);
            ledger.eventLog().subscribe(healthy);

            ledger.execute("emit", ALICE, tx -> {
                tx.emit(LINKED);
                return null;
            });

            verify(healthy).onEvent(1L, LINKED);
            assertEquals(1, ledger.eventLog().size());
            assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void ofTypeFiltersEvents() {
        ledger.execute("emit", ALICE, tx -> {
            tx.emit(LINKED);
            return null;
        });

        assertEquals(List.of(LINKED), ledger.eventLog().ofType(AgentDeveloperLinked.class));
        assertTrue(ledger.eventLog().ofType(AgentRegistered.class).isEmpty());
    }
}
