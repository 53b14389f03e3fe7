package dao.gaszero.relayer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    /**
     * Reject requests whose signature does not recover to the sender.
     * When false a mismatch is logged and the request proceeds (testnet demo policy).
     */
    private boolean requireValidSignature = true;

    /**
     * Deadline applied to intents that carry only a timestamp
     * Default: 300 seconds
     */
    private long defaultDeadlineSeconds = 300;

    /**
     * Relayer native balance (display units) below which health reports an alert
     * Default: 0.01
     */
    private BigDecimal lowBalanceAlertThreshold = new BigDecimal("0.01");

    private Confirmation confirmation = new Confirmation();
    private Gas gas = new Gas();
    private Swap swap = new Swap();

    @Data
    public static class Confirmation {
        /**
         * Receipt wait for transfers, approvals, wraps and value sends.
         */
        private long timeoutMs = 30_000;
        /**
         * Receipt wait for router calls.
         */
        private long swapTimeoutMs = 60_000;
        /**
         * Initial receipt poll interval.
         */
        private long pollInitialMs = 500;
        /**
         * Maximum receipt poll interval (backoff cap).
         */
        private long pollMaxMs = 3_000;
        /**
         * Threads available for concurrent receipt waits across all chains.
         */
        private int waiterThreads = 4;
    }

    @Data
    public static class Gas {
        private long approve = 100_000L;
        private long swap = 500_000L;
        private long wrap = 100_000L;
        private long unwrap = 100_000L;
        private long nativeTransfer = 21_000L;
    }

    @Data
    public static class Swap {
        /**
         * Pool fee tier for stablecoin pairs (0.01%).
         */
        private int stableFeeTier = 100;
        /**
         * Pool fee tier for every other pair (0.3%).
         */
        private int defaultFeeTier = 3_000;
    }
}
