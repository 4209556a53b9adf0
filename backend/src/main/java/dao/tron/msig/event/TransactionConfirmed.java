package dao.tron.msig.event;

public record TransactionConfirmed(String owner, long index) implements LedgerEvent {}
