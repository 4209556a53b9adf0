package dao.tron.msig.event;

public record TransactionRevoked(String owner, long index) implements LedgerEvent {}
