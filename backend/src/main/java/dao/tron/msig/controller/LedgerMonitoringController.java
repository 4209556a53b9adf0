package dao.tron.msig.controller;

import dao.tron.msig.config.SchedulerProperties;
import dao.tron.msig.event.EventJournal;
import dao.tron.msig.event.LedgerEvent;
import dao.tron.msig.event.TransactionSubmitted;
import dao.tron.msig.ledger.AuthorizationLedger;
import dao.tron.msig.ledger.TransactionRecord;
import dao.tron.msig.ledger.TransferCapability;
import dao.tron.msig.service.ProposalHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only overview of the ledger, the vault and the event journal.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
public class LedgerMonitoringController {

    private final AuthorizationLedger ledger;
    private final TransferCapability vault;
    private final EventJournal eventJournal;
    private final ProposalHasher proposalHasher;
    private final SchedulerProperties schedulerProps;

    public LedgerMonitoringController(AuthorizationLedger ledger,
                                      TransferCapability vault,
                                      EventJournal eventJournal,
                                      ProposalHasher proposalHasher,
                                      SchedulerProperties schedulerProps) {
        this.ledger = ledger;
        this.vault = vault;
        this.eventJournal = eventJournal;
        this.proposalHasher = proposalHasher;
        this.schedulerProps = schedulerProps;
    }

    /**
     * GET /api/monitor/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> response = new LinkedHashMap<>();

        List<TransactionRecord> transactions = ledger.getTransactions();
        long executed = transactions.stream().filter(TransactionRecord::executed).count();
        int ready = ledger.findExecutable().size();

        response.put("status", "SUCCESS");
        response.put("owners", ledger.getOwners().size());
        response.put("threshold", ledger.getThreshold());
        response.put("statistics", Map.of(
                "totalTransactions", transactions.size(),
                "executedTransactions", executed,
                "pendingTransactions", transactions.size() - executed,
                "readyTransactions", ready,
                "events", eventJournal.size()
        ));
        response.put("schedulers", Map.of(
                "execution", Map.of(
                        "enabled", schedulerProps.getExecution().isEnabled()
                )
        ));

        try {
            response.put("vaultBalance", vault.balance().toString());
        } catch (RuntimeException e) {
            log.warn("Vault balance unavailable: {}", e.getMessage());
            response.put("vaultBalance", "UNAVAILABLE");
        }

        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/transactions
     */
    @GetMapping("/transactions")
    public ResponseEntity<Map<String, Object>> getAllTransactions() {
        Map<String, Object> response = new LinkedHashMap<>();

        List<Map<String, Object>> infos = new ArrayList<>();
        for (TransactionRecord record : ledger.getTransactions()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("index", record.index());
            info.put("proposer", record.proposer());
            info.put("destination", record.destination());
            info.put("amount", record.amount().toString());
            info.put("executed", record.executed());
            info.put("confirmations", record.confirmations());
            info.put("confirmedBy", ledger.getConfirmers(record.index()));
            info.put("transferPending", ledger.isTransferPending(record.index()));
            info.put("txHash", proposalHasher.hashHex(record));
            infos.add(info);
        }

        response.put("status", "SUCCESS");
        response.put("totalTransactions", infos.size());
        response.put("transactions", infos);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/events
     */
    @GetMapping("/events")
    public ResponseEntity<Map<String, Object>> getEvents() {
        Map<String, Object> response = new LinkedHashMap<>();

        List<Map<String, Object>> infos = new ArrayList<>();
        for (LedgerEvent event : eventJournal.findAll()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("type", event.getClass().getSimpleName());
            info.put("owner", event.owner());
            info.put("index", event.index());
            if (event instanceof TransactionSubmitted submitted) {
                info.put("amount", submitted.amount().toString());
                info.put("balance", submitted.balance().toString());
            }
            infos.add(info);
        }

        response.put("status", "SUCCESS");
        response.put("totalEvents", infos.size());
        response.put("events", infos);
        return ResponseEntity.ok(response);
    }
}
