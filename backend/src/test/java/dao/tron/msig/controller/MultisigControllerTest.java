package dao.tron.msig.controller;

import dao.tron.msig.config.SchedulerProperties;
import dao.tron.msig.event.EventJournal;
import dao.tron.msig.ledger.AuthorizationLedger;
import dao.tron.msig.service.ProposalHasher;
import dao.tron.msig.service.SimulatedVault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigInteger;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Tests the REST binding of the ledger through MockMvc, including error status mapping.
 */
class MultisigControllerTest {

    private static final String A = "TKWvD71EMFTpFVGZyqqX9fC6MQgcR9H76M";
    private static final String B = "TToEDBXQkGuYGsnyJASTM5JZweb7Rvrnfn";
    private static final String C = "TUqVYQLKtNvLCjHw6uGPLw4Qmw7vXEavnc";
    private static final String D = "TVKAAcqpQxz3J4waayePr8dQjSQ2XHkdbF";
    private static final String OUTSIDER = "TAhZaywaWM1zAQPADJA39FyoQk8cokRLCd";

    private MockMvc mockMvc;
    private SimulatedVault vault;
    private EventJournal journal;

    @BeforeEach
    void setUp() {
        vault = new SimulatedVault(BigInteger.valueOf(1_000));
        journal = new EventJournal();
        AuthorizationLedger ledger = new AuthorizationLedger(List.of(A, B, C, D), vault, journal::record);
        ProposalHasher hasher = new ProposalHasher();

        mockMvc = MockMvcBuilders
                .standaloneSetup(
                        new MultisigController(ledger, hasher),
                        new LedgerMonitoringController(ledger, vault, journal, hasher, new SchedulerProperties()))
                .setControllerAdvice(new LedgerExceptionHandler())
                .build();
    }

    @Test
    void ownersAndThreshold() throws Exception {
        mockMvc.perform(get("/api/multisig/owners"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owners", contains(A, B, C, D)))
                .andExpect(jsonPath("$.threshold").value(2));
    }

    @Test
    void fullApprovalFlow() throws Exception {
        mockMvc.perform(post("/api/multisig/transactions")
                        .header("X-Caller", A)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\":\"" + B + "\",\"amount\":\"100\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.index").value(0))
                .andExpect(jsonPath("$.amount").value("100"))
                .andExpect(jsonPath("$.confirmations").value(0))
                .andExpect(jsonPath("$.txHash", startsWith("0x")));

        mockMvc.perform(post("/api/multisig/transactions/0/confirm").header("X-Caller", B))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmations").value(1));
        mockMvc.perform(post("/api/multisig/transactions/0/confirm").header("X-Caller", C))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmations").value(2));

        mockMvc.perform(get("/api/multisig/transactions/0/confirmations/" + C))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmed").value(true));

        mockMvc.perform(post("/api/multisig/transactions/0/execute").header("X-Caller", A))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executed").value(true));

        mockMvc.perform(post("/api/multisig/transactions/0/execute").header("X-Caller", A))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_EXECUTED"));

        mockMvc.perform(get("/api/multisig/transactions/count"))
                .andExpect(jsonPath("$.count").value(1));

        mockMvc.perform(get("/api/monitor/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEvents").value(4))
                .andExpect(jsonPath("$.events[0].type").value("TransactionSubmitted"))
                .andExpect(jsonPath("$.events[0].balance").value("1000"))
                .andExpect(jsonPath("$.events[3].type").value("TransactionExecuted"));

        mockMvc.perform(get("/api/monitor/stats"))
                .andExpect(jsonPath("$.statistics.executedTransactions").value(1))
                .andExpect(jsonPath("$.vaultBalance").value("900"));
    }

    @Test
    void errorStatusMapping() throws Exception {
        mockMvc.perform(post("/api/multisig/transactions")
                        .header("X-Caller", OUTSIDER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\":\"" + B + "\",\"amount\":\"1\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_OWNER"));

        mockMvc.perform(get("/api/multisig/transactions/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("TX_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/multisig/transactions/9"));

        mockMvc.perform(post("/api/multisig/transactions")
                        .header("X-Caller", A)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\":\"" + D + "\",\"amount\":\"5000\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/multisig/transactions/0/revoke").header("X-Caller", A))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("NOT_CONFIRMED"));

        mockMvc.perform(post("/api/multisig/transactions/0/execute").header("X-Caller", A))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_CONFIRMATIONS"));

        mockMvc.perform(post("/api/multisig/transactions/0/confirm").header("X-Caller", A));
        mockMvc.perform(post("/api/multisig/transactions/0/confirm").header("X-Caller", B));

        // amount exceeds the simulated balance
        mockMvc.perform(post("/api/multisig/transactions/0/execute").header("X-Caller", C))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("TRANSFER_FAILED"));

        mockMvc.perform(get("/api/multisig/transactions/0"))
                .andExpect(jsonPath("$.executed").value(false))
                .andExpect(jsonPath("$.confirmations").value(2));
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        mockMvc.perform(post("/api/multisig/transactions")
                        .header("X-Caller", A)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\":\"\",\"amount\":\"-5\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));

        mockMvc.perform(post("/api/multisig/transactions/0/confirm"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void amountAboveUint256IsRejectedBeforeSubmit() throws Exception {
        String tooLarge = BigInteger.TWO.pow(256).toString();

        mockMvc.perform(post("/api/multisig/transactions")
                        .header("X-Caller", A)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\":\"" + B + "\",\"amount\":\"" + tooLarge + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));

        mockMvc.perform(get("/api/multisig/transactions/count"))
                .andExpect(jsonPath("$.count").value(0));
        mockMvc.perform(get("/api/monitor/events"))
                .andExpect(jsonPath("$.totalEvents").value(0));

        String max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE).toString();
        mockMvc.perform(post("/api/multisig/transactions")
                        .header("X-Caller", A)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\":\"" + B + "\",\"amount\":\"" + max + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(max));
        mockMvc.perform(get("/api/monitor/transactions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactions[0].transferPending").value(false));
    }

    @Test
    void monitoringListsConfirmers() throws Exception {
        mockMvc.perform(post("/api/multisig/transactions")
                .header("X-Caller", A)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"destination\":\"" + B + "\",\"amount\":\"7\"}"));
        mockMvc.perform(post("/api/multisig/transactions/0/confirm").header("X-Caller", D));

        mockMvc.perform(get("/api/monitor/transactions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTransactions").value(1))
                .andExpect(jsonPath("$.transactions[0].confirmedBy", contains(D)))
                .andExpect(jsonPath("$.transactions[0].txHash", hasLength(66)));
    }
}
