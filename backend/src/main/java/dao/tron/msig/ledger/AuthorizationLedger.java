package dao.tron.msig.ledger;

import dao.tron.msig.event.*;
import dao.tron.msig.model.LedgerTransaction;
import dao.tron.msig.repository.InMemoryTransactionLog;
import dao.tron.msig.repository.TransactionLog;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.*;
import java.util.function.Supplier;

/**
 * Owner set, confirmation threshold and transaction log of a multisig vault.
 * <p>
 * Every public method holds this ledger's monitor for its whole duration, including the
 * vault transfer made by {@link #execute}. Mutating operations are all-or-nothing: each
 * mutation pushes an undo step, and an operation that throws replays those steps before
 * the exception leaves the ledger. Notifications are buffered and handed to the listener
 * only once the outermost operation has committed.
 * <p>
 * A vault that calls back into the ledger from {@code transfer} joins the running
 * operation, so its mutations are undone too if the transfer is then declined.
 * <p>
 * A vault may report a transfer as pending. The transaction then stays unexecuted, but it
 * cannot be revoked until a later {@link #execute} lets the vault settle the transfer.
 */
@Slf4j
public class AuthorizationLedger {

    public static final int CONFIRMATION_THRESHOLD = 2;

    /** Owner lists of this size or smaller are rejected. */
    static final int MAX_REJECTED_OWNER_COUNT = 3;

    /** Largest amount a TRC20 transfer can carry. */
    public static final BigInteger MAX_AMOUNT = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    private final List<String> owners;
    private final Set<String> ownerSet;
    private final TransactionLog transactionLog;
    private final TransferCapability vault;
    private final LedgerEventListener listener;

    // indexes whose transfer was sent but not settled; outlives rollback since the transfer cannot be recalled
    private final Set<Long> pendingTransfers = new HashSet<>();

    private final Deque<Runnable> undoJournal = new ArrayDeque<>();
    private final List<LedgerEvent> pendingEvents = new ArrayList<>();
    private int depth;

    public AuthorizationLedger(List<String> owners, TransferCapability vault, LedgerEventListener listener) {
        this(owners, vault, listener, new InMemoryTransactionLog());
    }

    AuthorizationLedger(List<String> owners,
                        TransferCapability vault,
                        LedgerEventListener listener,
                        TransactionLog transactionLog) {
        Objects.requireNonNull(owners, "owners");
        if (owners.size() <= MAX_REJECTED_OWNER_COUNT) {
            throw new LedgerException(LedgerError.INVALID_OWNER_COUNT,
                    "Owner count must be greater than " + MAX_REJECTED_OWNER_COUNT + " (got " + owners.size() + ")");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String owner : owners) {
            if (owner == null || owner.isBlank()) {
                throw new IllegalArgumentException("Owner identity must not be blank");
            }
            if (!distinct.add(owner)) {
                throw new LedgerException(LedgerError.DUPLICATE_OWNER, "Duplicate owner: " + owner);
            }
        }
        this.owners = List.copyOf(owners);
        this.ownerSet = Collections.unmodifiableSet(distinct);
        this.vault = Objects.requireNonNull(vault, "vault");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.transactionLog = Objects.requireNonNull(transactionLog, "transactionLog");

        log.info("AuthorizationLedger initialized: owners={}, threshold={}", this.owners.size(), CONFIRMATION_THRESHOLD);
    }

    public synchronized long submit(String caller, String destination, BigInteger amount) {
        return atomically(() -> {
            requireOwner(caller);
            if (destination == null || destination.isBlank()) {
                throw new IllegalArgumentException("Destination must not be blank");
            }
            if (amount == null || amount.signum() < 0) {
                throw new IllegalArgumentException("Amount must be a non-negative integer: " + amount);
            }
            if (amount.bitLength() > 256) {
                throw new IllegalArgumentException("Amount exceeds uint256: " + amount);
            }

            long index = transactionLog.append(new LedgerTransaction(caller, destination, amount));
            undoJournal.push(() -> transactionLog.truncate(index));

            BigInteger balance = vault.balance();
            emit(new TransactionSubmitted(caller, index, amount, balance));
            log.info("Transaction submitted: index={}, proposer={}, to={}, amount={}, balance={}",
                    index, caller, destination, amount, balance);
            return index;
        });
    }

    public synchronized void confirm(String caller, long index) {
        atomically(() -> {
            LedgerTransaction tx = requireTransaction(index);
            requireOwner(caller);
            if (transactionLog.isConfirmed(index, caller)) {
                throw new LedgerException(LedgerError.ALREADY_CONFIRMED,
                        "Transaction " + index + " already confirmed by " + caller);
            }
            requireNotExecuted(index, tx);

            setConfirmation(index, tx, caller, true);
            emit(new TransactionConfirmed(caller, index));
            log.info("Transaction confirmed: index={}, owner={}, confirmations={}", index, caller, tx.getConfirmations());
            return null;
        });
    }

    public synchronized void revoke(String caller, long index) {
        atomically(() -> {
            LedgerTransaction tx = requireTransaction(index);
            requireNotExecuted(index, tx);
            if (pendingTransfers.contains(index)) {
                throw new LedgerException(LedgerError.TRANSFER_PENDING,
                        "Transaction " + index + " has a transfer in flight and cannot be revoked");
            }
            // no owner check: a non-owner can never hold a confirmation
            if (!transactionLog.isConfirmed(index, caller)) {
                throw new LedgerException(LedgerError.NOT_CONFIRMED,
                        "Transaction " + index + " is not confirmed by " + caller);
            }

            setConfirmation(index, tx, caller, false);
            emit(new TransactionRevoked(caller, index));
            log.info("Confirmation revoked: index={}, owner={}, confirmations={}", index, caller, tx.getConfirmations());
            return null;
        });
    }

    public synchronized void execute(String caller, long index) {
        atomically(() -> {
            requireOwner(caller);
            LedgerTransaction tx = requireTransaction(index);
            requireNotExecuted(index, tx);
            if (tx.getConfirmations() < CONFIRMATION_THRESHOLD) {
                throw new LedgerException(LedgerError.INSUFFICIENT_CONFIRMATIONS,
                        "Transaction " + index + " has " + tx.getConfirmations()
                                + " confirmations, needs " + CONFIRMATION_THRESHOLD);
            }

            // flag first so a re-entrant execute from the vault sees the transaction as spent
            tx.setExecuted(true);
            undoJournal.push(() -> tx.setExecuted(false));

            boolean transferred;
            try {
                transferred = vault.transfer(index, tx.getDestination(), tx.getAmount());
            } catch (TransferPendingException e) {
                pendingTransfers.add(index);
                log.warn("Vault transfer pending: index={}, reference={}", index, e.getReference());
                throw new LedgerException(LedgerError.TRANSFER_PENDING,
                        "Transfer for transaction " + index + " is pending: " + e.getMessage(), e);
            } catch (RuntimeException e) {
                pendingTransfers.remove(index);
                log.warn("Vault transfer threw: index={}, to={}, amount={}, error={}",
                        index, tx.getDestination(), tx.getAmount(), e.getMessage());
                throw new LedgerException(LedgerError.TRANSFER_FAILED,
                        "Transfer for transaction " + index + " failed: " + e.getMessage(), e);
            }
            pendingTransfers.remove(index);
            if (!transferred) {
                log.warn("Vault declined transfer: index={}, to={}, amount={}", index, tx.getDestination(), tx.getAmount());
                throw new LedgerException(LedgerError.TRANSFER_FAILED,
                        "Transfer for transaction " + index + " was declined");
            }

            emit(new TransactionExecuted(caller, index));
            log.info("Transaction executed: index={}, by={}, to={}, amount={}",
                    index, caller, tx.getDestination(), tx.getAmount());
            return null;
        });
    }

    public List<String> getOwners() {
        return owners;
    }

    public boolean isOwner(String identity) {
        return identity != null && ownerSet.contains(identity);
    }

    public int getThreshold() {
        return CONFIRMATION_THRESHOLD;
    }

    public synchronized long getTransactionCount() {
        return transactionLog.count();
    }

    public synchronized TransactionRecord getTransaction(long index) {
        return toRecord(index, requireTransaction(index));
    }

    public synchronized List<TransactionRecord> getTransactions() {
        List<LedgerTransaction> all = transactionLog.findAll();
        List<TransactionRecord> out = new ArrayList<>(all.size());
        for (int i = 0; i < all.size(); i++) {
            out.add(toRecord(i, all.get(i)));
        }
        return out;
    }

    /**
     * Never fails: unknown indexes and identities report {@code false}.
     */
    public synchronized boolean isConfirmed(long index, String owner) {
        if (owner == null || index < 0 || index >= transactionLog.count()) return false;
        return transactionLog.isConfirmed(index, owner);
    }

    /**
     * Whether the last execution attempt for {@code index} left a transfer whose outcome is still unknown.
     */
    public synchronized boolean isTransferPending(long index) {
        return pendingTransfers.contains(index);
    }

    public synchronized Set<String> getConfirmers(long index) {
        requireTransaction(index);
        return transactionLog.findConfirmers(index);
    }

    /**
     * Indexes of pending transactions that have reached the threshold, in log order.
     */
    public synchronized List<Long> findExecutable() {
        List<LedgerTransaction> all = transactionLog.findAll();
        List<Long> ready = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            LedgerTransaction tx = all.get(i);
            if (!tx.isExecuted() && tx.getConfirmations() >= CONFIRMATION_THRESHOLD) {
                ready.add((long) i);
            }
        }
        return ready;
    }

    private <T> T atomically(Supplier<T> operation) {
        int undoMark = undoJournal.size();
        int eventMark = pendingEvents.size();
        depth++;
        boolean committed = false;
        try {
            T result = operation.get();
            committed = true;
            return result;
        } finally {
            depth--;
            if (!committed) {
                rollback(undoMark, eventMark);
            } else if (depth == 0) {
                undoJournal.clear();
                publishPending();
            }
        }
    }

    private void rollback(int undoMark, int eventMark) {
        int steps = undoJournal.size() - undoMark;
        while (undoJournal.size() > undoMark) {
            undoJournal.pop().run();
        }
        pendingEvents.subList(eventMark, pendingEvents.size()).clear();
        if (steps > 0) {
            log.debug("Rolled back {} ledger mutation(s)", steps);
        }
    }

    private void publishPending() {
        List<LedgerEvent> events = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        for (LedgerEvent event : events) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                // state is already committed; a listener failure must not surface as an operation failure
                log.error("Ledger event listener failed for {}", event, e);
            }
        }
    }

    private void emit(LedgerEvent event) {
        pendingEvents.add(event);
    }

    private void setConfirmation(long index, LedgerTransaction tx, String owner, boolean confirmed) {
        int delta = confirmed ? 1 : -1;
        transactionLog.setConfirmed(index, owner, confirmed);
        tx.setConfirmations(tx.getConfirmations() + delta);
        undoJournal.push(() -> {
            transactionLog.setConfirmed(index, owner, !confirmed);
            tx.setConfirmations(tx.getConfirmations() - delta);
        });
    }

    private void requireOwner(String caller) {
        if (!isOwner(caller)) {
            throw new LedgerException(LedgerError.NOT_OWNER, "Not an owner: " + caller);
        }
    }

    private LedgerTransaction requireTransaction(long index) {
        return transactionLog.findByIndex(index)
                .orElseThrow(() -> new LedgerException(LedgerError.TX_NOT_FOUND,
                        "Transaction not found: " + index));
    }

    private static void requireNotExecuted(long index, LedgerTransaction tx) {
        if (tx.isExecuted()) {
            throw new LedgerException(LedgerError.ALREADY_EXECUTED, "Transaction already executed: " + index);
        }
    }

    private TransactionRecord toRecord(long index, LedgerTransaction tx) {
        return new TransactionRecord(index, tx.getProposer(), tx.getDestination(), tx.getAmount(),
                tx.isExecuted(), tx.getConfirmations());
    }
}
