package dao.tron.msig.service;

import dao.tron.msig.config.TronProperties;
import dao.tron.msig.ledger.TransferCapability;
import dao.tron.msig.ledger.TransferPendingException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jcajce.provider.digest.SHA256;
import org.bouncycastle.util.encoders.Hex;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.FunctionReturnDecoder;
import org.tron.trident.abi.TypeReference;
import org.tron.trident.abi.datatypes.Address;
import org.tron.trident.abi.datatypes.Bool;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.core.NodeType;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Vault backed by a TRC20 balance held by the configured TRON account.
 * <p>
 * A transfer rejected before broadcast, or reverted on chain, is reported as declined. Once a
 * signed transfer may have reached the network without a receipt, the vault remembers its txId
 * per ledger transaction and throws {@link TransferPendingException}. The next attempt for that
 * transaction looks the txId up first and only sends again once it reverted, or expired unconfirmed.
 * <p>
 * {@link #balance()} is a constant call against the solidity node. The ledger reads it on every
 * submit, so a node outage blocks submissions as well as executions.
 */
@Slf4j
public class TronTrc20Vault implements TransferCapability, AutoCloseable {

    record PendingTransfer(String txId, long expiration) {}

    private final ApiWrapper wrapper;
    @Getter
    private final String vaultAddress;
    private final String tokenAddress;
    private final long feeLimit;
    private final TronProperties.Polling polling;
    private final Clock clock;

    private final Map<Long, PendingTransfer> pendingTransfers = new ConcurrentHashMap<>();

    public TronTrc20Vault(TronProperties props) {
        this(connect(props), props);
    }

    TronTrc20Vault(ApiWrapper wrapper, TronProperties props) {
        this(wrapper, wrapper.keyPair.toBase58CheckAddress(), props, Clock.systemUTC());
    }

    TronTrc20Vault(ApiWrapper wrapper, String vaultAddress, TronProperties props, Clock clock) {
        if (props.getTokenAddress() == null || props.getTokenAddress().isBlank()) {
            throw new IllegalArgumentException("tron.token-address must be set when a vault private key is configured");
        }
        this.wrapper = wrapper;
        this.vaultAddress = vaultAddress;
        this.tokenAddress = props.getTokenAddress();
        this.feeLimit = props.getFeeLimit();
        this.polling = props.getPolling();
        this.clock = clock;
        log.info("TronTrc20Vault initialized: network={}, vault={}, token={}",
                props.getNetwork(), vaultAddress, tokenAddress);
    }

    private static ApiWrapper connect(TronProperties props) {
        String privateKey = props.getPrivateKey();
        if (privateKey.length() % 2 != 0) {
            throw new IllegalArgumentException("Invalid private key format: odd-length hex string");
        }
        String network = props.getNetwork() == null ? "nile" : props.getNetwork().trim().toLowerCase();
        if (network.equals("mainnet")) {
            return ApiWrapper.ofMainnet(privateKey, props.getApiKey());
        }
        if (network.equals("shasta")) {
            return ApiWrapper.ofShasta(privateKey);
        }
        if (!network.equals("nile")) {
            throw new IllegalArgumentException("Unsupported tron.network: " + props.getNetwork());
        }
        return ApiWrapper.ofNile(privateKey);
    }

    @Override
    public boolean transfer(String destination, BigInteger amount) {
        return send(null, destination, amount);
    }

    @Override
    public boolean transfer(long index, String destination, BigInteger amount) {
        PendingTransfer previous = pendingTransfers.get(index);
        if (previous != null) {
            Response.TransactionInfo info = lookupTxInfo(previous.txId());
            if (info == null) {
                if (!isExpired(previous)) {
                    throw new TransferPendingException(previous.txId(),
                            "no receipt yet for txId " + previous.txId());
                }
                log.warn("TRC20 transfer expired unconfirmed, sending again: index={}, txId={}", index, previous.txId());
                pendingTransfers.remove(index);
            } else {
                pendingTransfers.remove(index);
                if (info.getResult() == Response.TransactionInfo.code.SUCESS) {
                    log.info("TRC20 transfer settled: index={}, txId={}", index, previous.txId());
                    return true;
                }
                log.warn("TRC20 transfer reverted on-chain, sending again: index={}, txId={}, message={}",
                        index, previous.txId(), info.getResMessage().toStringUtf8());
            }
        }
        return send(index, destination, amount);
    }

    private boolean send(Long index, String destination, BigInteger amount) {
        Chain.Transaction signed;
        try {
            Function transferFn = new Function(
                    "transfer",
                    Arrays.asList(new Address(destination), new Uint256(amount)),
                    Collections.singletonList(new TypeReference<Bool>() {})
            );

            String encodedHex = FunctionEncoder.encode(transferFn);

            Response.TransactionExtention txnExt = wrapper.triggerContract(
                    vaultAddress,
                    tokenAddress,
                    encodedHex,
                    0L,
                    0L,
                    null,
                    feeLimit
            );

            if (!txnExt.getResult().getResult()) {
                log.warn("TRC20 transfer trigger rejected: to={}, amount={}, message={}",
                        destination, amount, txnExt.getResult().getMessage().toStringUtf8());
                return false;
            }

            signed = wrapper.signTransaction(txnExt);
        } catch (Exception e) {
            log.error("TRC20 transfer could not be prepared: to={}, amount={}", destination, amount, e);
            return false;
        }

        // recorded before broadcast: from here on the transfer may reach the network
        PendingTransfer attempt = new PendingTransfer(transactionId(signed), signed.getRawData().getExpiration());
        remember(index, attempt);

        Response.TransactionInfo txInfo;
        try {
            String txId = wrapper.broadcastTransaction(signed);
            if (txId != null && !txId.equalsIgnoreCase(attempt.txId())) {
                log.debug("Node reported txId {} for local txId {}", txId, attempt.txId());
                attempt = new PendingTransfer(txId, attempt.expiration());
                remember(index, attempt);
            }
            txInfo = waitForTxInfo(
                    attempt.txId(),
                    Duration.ofSeconds(polling.getTxInfoTimeoutSeconds()),
                    Duration.ofMillis(polling.getTxInfoPollInitialMs()),
                    Duration.ofMillis(polling.getTxInfoPollMaxMs())
            );
        } catch (Exception e) {
            log.warn("TRC20 transfer broadcast outcome unknown: txId={}, reason={}", attempt.txId(), e.getMessage());
            txInfo = null;
        }

        if (txInfo == null) {
            if (isExpired(attempt)) {
                forget(index);
                log.warn("TRC20 transfer expired without receipt: txId={}", attempt.txId());
                return false;
            }
            log.warn("TRC20 transfer: no TransactionInfo after timeout. txId={}", attempt.txId());
            throw new TransferPendingException(attempt.txId(), "no receipt within timeout for txId " + attempt.txId());
        }

        forget(index);
        if (txInfo.getResult() != Response.TransactionInfo.code.SUCESS) {
            log.warn("TRC20 transfer failed on-chain: {}. txId={}", txInfo.getResMessage().toStringUtf8(), attempt.txId());
            return false;
        }

        log.info("TRC20 transfer SUCCESS: txId={}, to={}, amount={}", attempt.txId(), destination, amount);
        return true;
    }

    @Override
    public BigInteger balance() {
        Function balanceOfFn = new Function(
                "balanceOf",
                Collections.singletonList(new Address(vaultAddress)),
                Collections.singletonList(new TypeReference<Uint256>() {})
        );

        Response.TransactionExtention txn = wrapper.triggerConstantContract(
                vaultAddress,
                tokenAddress,
                FunctionEncoder.encode(balanceOfFn),
                NodeType.SOLIDITY_NODE
        );

        if (!txn.getResult().getResult() || txn.getConstantResultCount() == 0) {
            throw new IllegalStateException("balanceOf failed: " + txn.getResult().getMessage().toStringUtf8());
        }

        String resultHex = Numeric.toHexString(txn.getConstantResult(0).toByteArray());
        @SuppressWarnings("rawtypes")
        List<Type> decoded = FunctionReturnDecoder.decode(resultHex, balanceOfFn.getOutputParameters());
        if (decoded.size() != 1) {
            throw new IllegalStateException("Unexpected balanceOf outputs=" + decoded.size());
        }
        return ((Uint256) decoded.get(0)).getValue();
    }

    boolean hasPendingTransfer(long index) {
        return pendingTransfers.containsKey(index);
    }

    private void remember(Long index, PendingTransfer attempt) {
        if (index != null) {
            pendingTransfers.put(index, attempt);
        }
    }

    private void forget(Long index) {
        if (index != null) {
            pendingTransfers.remove(index);
        }
    }

    private boolean isExpired(PendingTransfer transfer) {
        return clock.millis() > transfer.expiration() + polling.getExpiryGraceMs();
    }

    /** TRON txId: SHA-256 of the raw transaction data. */
    static String transactionId(Chain.Transaction transaction) {
        return Hex.toHexString(new SHA256.Digest().digest(transaction.getRawData().toByteArray()));
    }

    private Response.TransactionInfo lookupTxInfo(String txId) {
        try {
            Response.TransactionInfo info = wrapper.getTransactionInfoById(txId);
            return isMined(info) ? info : null;
        } catch (Exception e) {
            log.debug("TransactionInfo not available: txId={}, reason={}", txId, e.getMessage());
            return null;
        }
    }

    private Response.TransactionInfo waitForTxInfo(String txId, Duration timeout, Duration pollInitial, Duration pollMax) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(100, pollInitial.toMillis());
        long maxSleepMs = Math.max(sleepMs, pollMax.toMillis());
        while (System.currentTimeMillis() < deadline) {
            Response.TransactionInfo info = lookupTxInfo(txId);
            if (info != null) return info;
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, 150);
                Thread.sleep(sleepMs + jitter);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return null;
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        return null;
    }

    // an unknown txId comes back as an empty TransactionInfo
    private static boolean isMined(Response.TransactionInfo info) {
        return info != null && info.getBlockNumber() > 0;
    }

    @Override
    public void close() {
        wrapper.close();
    }
}
