package dao.gaszero.relayer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "sponsorship")
@Data
public class SponsorshipProperties {

    /**
     * Enable/disable approval gas sponsorship
     * Default: true
     */
    private boolean enabled = true;

    /**
     * Native amount (wei) sent to a user so they can pay for one approval
     * Default: 0.001 ETH
     */
    private BigInteger fundingAmountWei = new BigInteger("1000000000000000");

    /**
     * Gas limit of the plain value transfer
     */
    private long gasLimit = 21_000L;

    /**
     * Required gap after the 1st, 2nd, 3rd (and every later) funding of the same user.
     */
    private List<Duration> cooldowns = new ArrayList<>(List.of(
            Duration.ofHours(1),
            Duration.ofHours(2),
            Duration.ofHours(24)
    ));

    /**
     * Funding history older than this is dropped, which also resets the escalation.
     * Default: 7 days
     */
    private Duration historyRetention = Duration.ofDays(7);
}
