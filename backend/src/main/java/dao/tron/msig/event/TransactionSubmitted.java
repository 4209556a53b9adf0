package dao.tron.msig.event;

import java.math.BigInteger;

/**
 * @param balance vault balance observed right after the submission
 */
public record TransactionSubmitted(
        String owner,
        long index,
        BigInteger amount,
        BigInteger balance
) implements LedgerEvent {}
