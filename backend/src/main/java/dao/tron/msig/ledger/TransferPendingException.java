package dao.tron.msig.ledger;

import lombok.Getter;

/**
 * Thrown by a vault when a transfer has left the vault but its outcome is not known yet.
 * The transfer must not be attempted again until the vault has settled it.
 */
@Getter
public class TransferPendingException extends RuntimeException {

    private final String reference;

    public TransferPendingException(String reference, String message) {
        super(message);
        this.reference = reference;
    }
}
