package dao.tron.msig.ledger;

import java.math.BigInteger;

/**
 * Value-holding environment the ledger pays out of.
 */
public interface TransferCapability {

    /**
     * Move {@code amount} from the vault to {@code destination}.
     *
     * @return false when the transfer was declined; the vault balance is unchanged in that case
     */
    boolean transfer(String destination, BigInteger amount);

    /**
     * Transfer on behalf of ledger transaction {@code index}. Vaults whose transfers can be left
     * in flight use the index to reconcile an earlier attempt instead of paying twice.
     *
     * @throws TransferPendingException when an attempt for {@code index} was sent but its outcome is not known yet
     */
    default boolean transfer(long index, String destination, BigInteger amount) {
        return transfer(destination, amount);
    }

    BigInteger balance();
}
