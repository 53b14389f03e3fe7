package dao.gaszero.relayer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private EvictionConfig eviction = new EvictionConfig();
    private BalanceMonitorConfig balanceMonitor = new BalanceMonitorConfig();

    @Data
    public static class EvictionConfig {
        /**
         * Enable/disable eviction of expired rate-limit and funding-history entries
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often expired entries are removed (in milliseconds)
         * Default: 60000ms
         */
        private long checkIntervalMs = 60_000;
    }

    @Data
    public static class BalanceMonitorConfig {
        /**
         * Enable/disable periodic relayer balance checks
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often relayer balances are checked (in milliseconds)
         * Default: 300000ms (5 minutes)
         */
        private long checkIntervalMs = 300_000;
    }
}
