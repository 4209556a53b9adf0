package dao.tron.msig.service;

import dao.tron.msig.ledger.TransferCapability;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.*;

/**
 * In-process vault for local runs and tests. Declines transfers that exceed the balance
 * or target a blocked destination.
 */
@Slf4j
public class SimulatedVault implements TransferCapability {

    public record Payout(String destination, BigInteger amount) {}

    private BigInteger balance;
    private final Set<String> blockedDestinations = new HashSet<>();
    private final List<Payout> payouts = new ArrayList<>();

    public SimulatedVault(BigInteger initialBalance) {
        this(initialBalance, List.of());
    }

    public SimulatedVault(BigInteger initialBalance, Collection<String> blockedDestinations) {
        if (initialBalance == null || initialBalance.signum() < 0) {
            throw new IllegalArgumentException("Initial balance must be non-negative: " + initialBalance);
        }
        this.balance = initialBalance;
        this.blockedDestinations.addAll(blockedDestinations);
    }

    @Override
    public synchronized boolean transfer(String destination, BigInteger amount) {
        if (blockedDestinations.contains(destination)) {
            log.warn("Simulated transfer declined, destination blocked: to={}, amount={}", destination, amount);
            return false;
        }
        if (amount.compareTo(balance) > 0) {
            log.warn("Simulated transfer declined, insufficient balance: to={}, amount={}, balance={}",
                    destination, amount, balance);
            return false;
        }
        balance = balance.subtract(amount);
        payouts.add(new Payout(destination, amount));
        log.info("Simulated transfer: to={}, amount={}, balance={}", destination, amount, balance);
        return true;
    }

    @Override
    public synchronized BigInteger balance() {
        return balance;
    }

    public synchronized void deposit(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Deposit must be non-negative: " + amount);
        }
        balance = balance.add(amount);
    }

    public synchronized void block(String destination) {
        blockedDestinations.add(destination);
    }

    public synchronized void release(String destination) {
        blockedDestinations.remove(destination);
    }

    public synchronized List<Payout> getPayouts() {
        return new ArrayList<>(payouts);
    }
}
