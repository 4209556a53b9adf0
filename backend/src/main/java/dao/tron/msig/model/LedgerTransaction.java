package dao.tron.msig.model;

import lombok.Data;

import java.math.BigInteger;

@Data
public class LedgerTransaction {

    private String proposer;
    private String destination;
    private BigInteger amount;
    private boolean executed;
    private int confirmations;   // always equals the number of owners in the confirmation matrix

    public LedgerTransaction(String proposer, String destination, BigInteger amount) {
        this.proposer = proposer;
        this.destination = destination;
        this.amount = amount;
    }
}
