package dao.tron.msig.repository;

import dao.tron.msig.model.LedgerTransaction;

import java.util.*;

/**
 * Not thread-safe; the owning ledger serializes access.
 */
public class InMemoryTransactionLog implements TransactionLog {

    private final List<LedgerTransaction> transactions = new ArrayList<>();

    // key: transaction index -> owners holding an outstanding confirmation
    private final Map<Long, Set<String>> confirmersByIndex = new HashMap<>();

    @Override
    public long append(LedgerTransaction transaction) {
        transactions.add(transaction);
        return transactions.size() - 1L;
    }

    @Override
    public Optional<LedgerTransaction> findByIndex(long index) {
        if (index < 0 || index >= transactions.size()) return Optional.empty();
        return Optional.of(transactions.get((int) index));
    }

    @Override
    public long count() {
        return transactions.size();
    }

    @Override
    public List<LedgerTransaction> findAll() {
        return new ArrayList<>(transactions);
    }

    @Override
    public void truncate(long size) {
        if (size < 0 || size > transactions.size()) {
            throw new IndexOutOfBoundsException("Invalid log size: " + size + " (count=" + transactions.size() + ")");
        }
        for (long i = transactions.size() - 1L; i >= size; i--) {
            confirmersByIndex.remove(i);
        }
        transactions.subList((int) size, transactions.size()).clear();
    }

    @Override
    public boolean isConfirmed(long index, String owner) {
        Set<String> confirmers = confirmersByIndex.get(index);
        return confirmers != null && confirmers.contains(owner);
    }

    @Override
    public void setConfirmed(long index, String owner, boolean confirmed) {
        if (confirmed) {
            confirmersByIndex.computeIfAbsent(index, k -> new LinkedHashSet<>()).add(owner);
        } else {
            Set<String> confirmers = confirmersByIndex.get(index);
            if (confirmers != null) confirmers.remove(owner);
        }
    }

    @Override
    public Set<String> findConfirmers(long index) {
        Set<String> confirmers = confirmersByIndex.get(index);
        if (confirmers == null) return Set.of();
        return Collections.unmodifiableSet(new LinkedHashSet<>(confirmers));
    }
}
