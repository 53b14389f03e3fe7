package dao.gaszero.relayer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "rate-limit")
@Data
public class RateLimitProperties {

    /**
     * Requests allowed per key within one window
     * Default: 10
     */
    private int maxRequests = 10;

    /**
     * Fixed window length
     * Default: 1h
     */
    private Duration window = Duration.ofHours(1);
}
