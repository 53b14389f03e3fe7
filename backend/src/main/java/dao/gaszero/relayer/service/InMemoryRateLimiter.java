package dao.gaszero.relayer.service;

import dao.gaszero.relayer.config.RateLimitProperties;
import dao.gaszero.relayer.model.RateLimitEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Fixed-window counter per key.
 */
@Slf4j
@Component
public class InMemoryRateLimiter implements RateLimiter {

    private final RateLimitProperties props;
    private final Clock clock;
    private final Map<String, RateLimitEntry> entries = new HashMap<>();

    public InMemoryRateLimiter(RateLimitProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    @Override
    public synchronized boolean allow(String key) {
        Instant now = clock.instant();
        RateLimitEntry entry = entries.get(key);
        if (entry == null || !now.isBefore(entry.getWindowResetAt())) {
            entries.put(key, new RateLimitEntry(1, now.plus(props.getWindow())));
            return true;
        }
        if (entry.getCount() >= props.getMaxRequests()) {
            log.debug("Rate limit hit: key={}, count={}, resetAt={}", key, entry.getCount(), entry.getWindowResetAt());
            return false;
        }
        entry.setCount(entry.getCount() + 1);
        return true;
    }

    @Override
    public synchronized int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> !now.isBefore(e.getWindowResetAt()));
        return before - entries.size();
    }

    synchronized int size() {
        return entries.size();
    }
}
