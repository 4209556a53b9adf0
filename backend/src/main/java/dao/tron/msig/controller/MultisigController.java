package dao.tron.msig.controller;

import dao.tron.msig.ledger.AuthorizationLedger;
import dao.tron.msig.ledger.TransactionRecord;
import dao.tron.msig.model.SubmitTransactionRequest;
import dao.tron.msig.service.ProposalHasher;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP binding of the ledger operations.
 * The acting identity is taken from the {@code X-Caller} header; authenticating it is up to the gateway.
 */
@Slf4j
@RestController
@RequestMapping("/api/multisig")
public class MultisigController {

    static final String CALLER_HEADER = "X-Caller";

    private final AuthorizationLedger ledger;
    private final ProposalHasher proposalHasher;

    public MultisigController(AuthorizationLedger ledger, ProposalHasher proposalHasher) {
        this.ledger = ledger;
        this.proposalHasher = proposalHasher;
    }

    @GetMapping("/owners")
    public ResponseEntity<Map<String, Object>> getOwners() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("owners", ledger.getOwners());
        response.put("threshold", ledger.getThreshold());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/transactions/count")
    public ResponseEntity<Map<String, Object>> getTransactionCount() {
        return ResponseEntity.ok(Map.of("count", ledger.getTransactionCount()));
    }

    @GetMapping("/transactions/{index}")
    public ResponseEntity<Map<String, Object>> getTransaction(@PathVariable long index) {
        return ResponseEntity.ok(buildTransactionInfo(ledger.getTransaction(index)));
    }

    @GetMapping("/transactions/{index}/confirmations/{owner}")
    public ResponseEntity<Map<String, Object>> isConfirmed(@PathVariable long index, @PathVariable String owner) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("index", index);
        response.put("owner", owner);
        response.put("confirmed", ledger.isConfirmed(index, owner));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/transactions")
    public ResponseEntity<Map<String, Object>> submit(@RequestHeader(CALLER_HEADER) String caller,
                                                      @Valid @RequestBody SubmitTransactionRequest req) {
        long index = ledger.submit(caller, req.getDestination(), new BigInteger(req.getAmount()));
        return ResponseEntity.ok(buildTransactionInfo(ledger.getTransaction(index)));
    }

    @PostMapping("/transactions/{index}/confirm")
    public ResponseEntity<Map<String, Object>> confirm(@RequestHeader(CALLER_HEADER) String caller,
                                                       @PathVariable long index) {
        ledger.confirm(caller, index);
        return ResponseEntity.ok(buildTransactionInfo(ledger.getTransaction(index)));
    }

    @PostMapping("/transactions/{index}/revoke")
    public ResponseEntity<Map<String, Object>> revoke(@RequestHeader(CALLER_HEADER) String caller,
                                                      @PathVariable long index) {
        ledger.revoke(caller, index);
        return ResponseEntity.ok(buildTransactionInfo(ledger.getTransaction(index)));
    }

    @PostMapping("/transactions/{index}/execute")
    public ResponseEntity<Map<String, Object>> execute(@RequestHeader(CALLER_HEADER) String caller,
                                                       @PathVariable long index) {
        ledger.execute(caller, index);
        return ResponseEntity.ok(buildTransactionInfo(ledger.getTransaction(index)));
    }

    private Map<String, Object> buildTransactionInfo(TransactionRecord record) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("index", record.index());
        info.put("proposer", record.proposer());
        info.put("destination", record.destination());
        info.put("amount", record.amount().toString());     // string decimal, uint256 does not fit a JSON number
        info.put("executed", record.executed());
        info.put("confirmations", record.confirmations());
        info.put("txHash", proposalHasher.hashHex(record));
        return info;
    }
}
