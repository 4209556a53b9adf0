package dao.tron.msig.repository;

import dao.tron.msig.model.LedgerTransaction;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only, index-addressed store of proposed transactions together with
 * the per-owner confirmation matrix.
 */
public interface TransactionLog {

    /**
     * @return the index assigned to the appended transaction
     */
    long append(LedgerTransaction transaction);

    Optional<LedgerTransaction> findByIndex(long index);

    long count();

    List<LedgerTransaction> findAll();

    /**
     * Drop every transaction at or after {@code size}, along with its confirmations.
     * Only used to undo appends of an operation that did not commit.
     */
    void truncate(long size);

    boolean isConfirmed(long index, String owner);

    void setConfirmed(long index, String owner, boolean confirmed);

    Set<String> findConfirmers(long index);
}
