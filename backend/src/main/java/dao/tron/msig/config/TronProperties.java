package dao.tron.msig.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "tron")
@Data
public class TronProperties {

    /**
     * Target network: nile, shasta or mainnet.
     * Default: nile
     */
    private String network = "nile";

    /**
     * TronGrid API key, only used for mainnet.
     */
    private String apiKey;

    /**
     * Vault private key (hex format, 64 characters).
     * Leave empty to run against the simulated vault.
     */
    private String privateKey;

    /**
     * TRC20 token contract the vault pays out of (base58 format)
     * Example: TXYZopYRdj2D9XRtbG411XZZ3kM5VkAeBf
     */
    private String tokenAddress;

    /**
     * Fee limit for transfer calls, in sun.
     */
    private long feeLimit = 50_000_000L;

    private Polling polling = new Polling();

    @Data
    public static class Polling {
        /**
         * Timeout for getting TransactionInfo after broadcasting a transfer.
         */
        private long txInfoTimeoutSeconds = 60;
        /**
         * Initial poll interval for TransactionInfo.
         */
        private long txInfoPollInitialMs = 250;
        /**
         * Maximum poll interval for TransactionInfo (backoff cap).
         */
        private long txInfoPollMaxMs = 2000;
        /**
         * How long past its expiration an unconfirmed transfer is still awaited before
         * it is considered dropped and may be sent again.
         */
        private long expiryGraceMs = 30_000;
    }

    public boolean isConfigured() {
        return privateKey != null && !privateKey.isBlank() && !privateKey.equals("YOUR_PRIVATE_KEY_HERE");
    }
}
