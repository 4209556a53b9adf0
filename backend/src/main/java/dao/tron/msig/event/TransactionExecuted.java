package dao.tron.msig.event;

public record TransactionExecuted(String owner, long index) implements LedgerEvent {}
