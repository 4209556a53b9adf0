package dao.tron.msig.scheduler;

import dao.tron.msig.config.SchedulerProperties;
import dao.tron.msig.ledger.AuthorizationLedger;
import dao.tron.msig.ledger.LedgerError;
import dao.tron.msig.ledger.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Executes, as the configured operator owner, every pending transaction that reached the
 * confirmation threshold. Declined transfers stay pending and are retried on the next tick.
 */
@Slf4j
@Component
public class ExecutionScheduler {

    private final AuthorizationLedger ledger;
    private final SchedulerProperties schedulerProps;

    public ExecutionScheduler(AuthorizationLedger ledger, SchedulerProperties schedulerProps) {
        this.ledger = ledger;
        this.schedulerProps = schedulerProps;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void checkOperatorOnStartup() {
        SchedulerProperties.ExecutionConfig config = schedulerProps.getExecution();
        if (config.isEnabled() && !ledger.isOwner(config.getOperator())) {
            log.warn("Auto-execution enabled but operator {} is not an owner; every run will be skipped.",
                    config.getOperator());
        }
    }

    @Scheduled(fixedDelayString = "${scheduler.execution.check-interval-ms:5000}")
    public void executeReadyTransactions() {
        runOnce();
    }

    /**
     * @return number of transactions executed in this run
     */
    int runOnce() {
        SchedulerProperties.ExecutionConfig config = schedulerProps.getExecution();
        if (!config.isEnabled()) {
            return 0;
        }
        String operator = config.getOperator();
        if (!ledger.isOwner(operator)) {
            log.debug("Skipping auto-execution: operator {} is not an owner", operator);
            return 0;
        }

        List<Long> ready = ledger.findExecutable();
        if (ready.isEmpty()) {
            return 0;
        }

        int executed = 0;
        for (long index : ready) {
            try {
                ledger.execute(operator, index);
                executed++;
            } catch (LedgerException e) {
                if (e.getError() == LedgerError.TRANSFER_FAILED) {
                    log.warn("Auto-execution of transaction {} failed, will retry: {}", index, e.getMessage());
                } else if (e.getError() == LedgerError.TRANSFER_PENDING) {
                    log.info("Auto-execution of transaction {} awaiting settlement: {}", index, e.getMessage());
                } else {
                    // revoked or executed by an owner since the scan
                    log.info("Auto-execution of transaction {} skipped: {}", index, e.getError());
                }
            }
        }
        log.info("Auto-execution finished: ready={}, executed={}", ready.size(), executed);
        return executed;
    }
}
