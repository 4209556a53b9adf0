package dao.tron.msig.ledger;

/**
 * Failure causes of ledger operations.
 */
public enum LedgerError {

    // authorization
    NOT_OWNER,

    // reference
    TX_NOT_FOUND,

    // state conflict
    ALREADY_CONFIRMED,
    NOT_CONFIRMED,
    ALREADY_EXECUTED,

    // policy
    INSUFFICIENT_CONFIRMATIONS,

    /** The vault declined the transfer. The only error a caller may retry after fixing the external cause. */
    TRANSFER_FAILED,

    /** A transfer was sent but has not settled yet; execute again to reconcile it. */
    TRANSFER_PENDING,

    // construction
    INVALID_OWNER_COUNT,
    DUPLICATE_OWNER
}
