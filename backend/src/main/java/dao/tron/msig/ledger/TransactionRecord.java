package dao.tron.msig.ledger;

import java.math.BigInteger;

/**
 * Read-only copy of a proposed transfer as seen at query time.
 */
public record TransactionRecord(
        long index,
        String proposer,
        String destination,
        BigInteger amount,
        boolean executed,
        int confirmations
) {}
