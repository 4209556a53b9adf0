package dao.tron.msig.event;

/**
 * Notification emitted after a ledger operation commits.
 */
public interface LedgerEvent {

    /** Identity that performed the operation. */
    String owner();

    long index();
}
