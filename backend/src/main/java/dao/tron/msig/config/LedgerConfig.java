package dao.tron.msig.config;

import dao.tron.msig.event.SpringLedgerEventPublisher;
import dao.tron.msig.ledger.AuthorizationLedger;
import dao.tron.msig.ledger.TransferCapability;
import dao.tron.msig.service.SimulatedVault;
import dao.tron.msig.service.TronTrc20Vault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class LedgerConfig {

    @Bean
    public TransferCapability vault(TronProperties tronProps, MultisigProperties multisigProps) {
        if (tronProps.isConfigured()) {
            return new TronTrc20Vault(tronProps);
        }
        log.warn("No valid private key configured. Set TRON_PRIVATE_KEY to pay out of a TRON vault; using simulated vault.");
        MultisigProperties.Vault vault = multisigProps.getVault();
        return new SimulatedVault(vault.getInitialBalance(), vault.getBlockedDestinations());
    }

    /**
     * Fails startup when multisig.owners is not a list of more than 3 distinct identities.
     */
    @Bean
    public AuthorizationLedger authorizationLedger(MultisigProperties multisigProps,
                                                   TransferCapability vault,
                                                   SpringLedgerEventPublisher eventPublisher) {
        return new AuthorizationLedger(multisigProps.getOwners(), vault, eventPublisher);
    }
}
