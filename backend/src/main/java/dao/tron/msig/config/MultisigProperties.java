package dao.tron.msig.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "multisig")
@Data
public class MultisigProperties {

    /**
     * Owner identities (base58 format when bound to a TRON vault).
     * More than 3 distinct entries are required, otherwise startup fails.
     * Example: ["TKWvD71EMFTpFVGZyqqX9fC6MQgcR9H76M", "TToEDBXQkGuYGsnyJASTM5JZweb7Rvrnfn", ...]
     */
    private List<String> owners = new ArrayList<>();

    /**
     * Simulated vault used when no TRON private key is configured.
     */
    private Vault vault = new Vault();

    @Data
    public static class Vault {
        /**
         * Starting balance of the simulated vault, in the token's smallest unit.
         */
        private BigInteger initialBalance = BigInteger.ZERO;

        /**
         * Destinations the simulated vault refuses to pay until released.
         */
        private List<String> blockedDestinations = new ArrayList<>();
    }
}
