package dao.tron.msig.ledger;

import dao.tron.msig.event.*;
import dao.tron.msig.service.SimulatedVault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end approval flows on a 4-owner, 2-of-N ledger.
 */
class AuthorizationLedgerScenarioTest {

    private static final String A = "owner-a";
    private static final String B = "owner-b";
    private static final String C = "owner-c";
    private static final String D = "owner-d";
    private static final String E = "outsider-e";

    private SimulatedVault vault;
    private List<LedgerEvent> events;
    private AuthorizationLedger ledger;

    @BeforeEach
    void setUp() {
        vault = new SimulatedVault(BigInteger.valueOf(10_000));
        events = new ArrayList<>();
        ledger = new AuthorizationLedger(List.of(A, B, C, D), vault, events::add);
    }

    @Test
    @DisplayName("A submits, B and C confirm, A executes, repeat execute fails")
    void happyPath() {
        long index = ledger.submit(A, B, BigInteger.valueOf(100));
        assertEquals(0, index);
        assertEquals(0, ledger.getTransaction(index).confirmations());

        ledger.confirm(B, index);
        assertEquals(1, ledger.getTransaction(index).confirmations());

        ledger.confirm(C, index);
        assertEquals(2, ledger.getTransaction(index).confirmations());
        assertTrue(ledger.isConfirmed(index, C));

        ledger.execute(A, index);
        assertTrue(ledger.getTransaction(index).executed());
        assertEquals(List.of(new SimulatedVault.Payout(B, BigInteger.valueOf(100))), vault.getPayouts());

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.execute(A, index));
        assertEquals(LedgerError.ALREADY_EXECUTED, e.getError());

        assertEquals(List.of(
                new TransactionSubmitted(A, 0, BigInteger.valueOf(100), BigInteger.valueOf(10_000)),
                new TransactionConfirmed(B, 0),
                new TransactionConfirmed(C, 0),
                new TransactionExecuted(A, 0)
        ), events);
    }

    @Test
    @DisplayName("Non-owner E is rejected everywhere and the ledger is unchanged")
    void outsiderIsRejected() {
        long index = ledger.submit(A, B, BigInteger.valueOf(100));
        ledger.confirm(A, index);
        ledger.confirm(B, index);
        TransactionRecord before = ledger.getTransaction(index);
        int eventsBefore = events.size();

        assertEquals(LedgerError.NOT_OWNER,
                assertThrows(LedgerException.class, () -> ledger.submit(E, E, BigInteger.ONE)).getError());
        assertEquals(LedgerError.NOT_OWNER,
                assertThrows(LedgerException.class, () -> ledger.confirm(E, index)).getError());
        assertEquals(LedgerError.NOT_OWNER,
                assertThrows(LedgerException.class, () -> ledger.execute(E, index)).getError());
        assertEquals(LedgerError.NOT_OWNER,
                assertThrows(LedgerException.class, () -> ledger.execute(E, 42)).getError());

        assertEquals(1, ledger.getTransactionCount());
        assertEquals(before, ledger.getTransaction(index));
        assertFalse(ledger.isConfirmed(index, E));
        assertEquals(eventsBefore, events.size());
        assertTrue(vault.getPayouts().isEmpty());
    }

    @Test
    @DisplayName("Declined transfer leaves the transaction pending and a retry succeeds once the destination is valid")
    void transferFailureThenRetry() {
        vault.block(D);
        long index = ledger.submit(A, D, BigInteger.valueOf(250));
        ledger.confirm(A, index);
        ledger.confirm(B, index);
        int eventsBefore = events.size();

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.execute(C, index));

        assertEquals(LedgerError.TRANSFER_FAILED, e.getError());
        TransactionRecord afterFailure = ledger.getTransaction(index);
        assertFalse(afterFailure.executed());
        assertEquals(2, afterFailure.confirmations());
        assertEquals(eventsBefore, events.size());
        assertEquals(BigInteger.valueOf(10_000), vault.balance());

        vault.release(D);
        ledger.execute(C, index);

        assertTrue(ledger.getTransaction(index).executed());
        assertEquals(BigInteger.valueOf(9_750), vault.balance());
        assertEquals(new TransactionExecuted(C, index), events.get(events.size() - 1));
    }

    @Test
    @DisplayName("Revoking below the threshold blocks execution until another owner confirms")
    void revokeBlocksExecution() {
        long index = ledger.submit(B, C, BigInteger.TEN);
        ledger.confirm(A, index);
        ledger.confirm(B, index);
        ledger.revoke(A, index);

        assertEquals(LedgerError.INSUFFICIENT_CONFIRMATIONS,
                assertThrows(LedgerException.class, () -> ledger.execute(B, index)).getError());

        ledger.confirm(D, index);
        ledger.execute(B, index);

        assertTrue(ledger.getTransaction(index).executed());
        assertFalse(ledger.isConfirmed(index, A));
        assertTrue(ledger.isConfirmed(index, D));
    }

    @Test
    @DisplayName("Confirmation count always matches the confirmation matrix")
    void countMatchesMatrix() {
        long first = ledger.submit(A, B, BigInteger.ONE);
        long second = ledger.submit(C, D, BigInteger.ONE);
        ledger.confirm(A, first);
        ledger.confirm(B, first);
        ledger.confirm(C, first);
        ledger.revoke(B, first);
        ledger.confirm(D, second);
        assertThrows(LedgerException.class, () -> ledger.confirm(D, second));
        assertThrows(LedgerException.class, () -> ledger.revoke(A, second));

        for (long index : List.of(first, second)) {
            long matrixCount = List.of(A, B, C, D).stream().filter(o -> ledger.isConfirmed(index, o)).count();
            assertEquals(matrixCount, ledger.getTransaction(index).confirmations());
            assertEquals(matrixCount, ledger.getConfirmers(index).size());
        }
    }
}
