package dao.gaszero.relayer.service;

/**
 * Per-requester admission control. Implementations backed by a shared store can replace the
 * in-memory one without touching callers.
 */
public interface RateLimiter {

    /**
     * Counts one request for {@code key}.
     *
     * @return false when the key already used its quota in the current window
     */
    boolean allow(String key);

    /**
     * @return number of entries removed
     */
    int evictExpired();
}
