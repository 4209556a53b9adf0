package dao.tron.msig.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private ExecutionConfig execution = new ExecutionConfig();

    @Data
    public static class ExecutionConfig {
        /**
         * Enable/disable automatic execution of transactions that reached the threshold
         * Default: false
         */
        private boolean enabled = false;

        /**
         * How often to look for executable transactions (in milliseconds)
         * Default: 5000ms (5 seconds)
         */
        private long checkIntervalMs = 5000;

        /**
         * Owner identity the scheduler executes as. Must be one of multisig.owners.
         */
        private String operator;
    }
}
