package dao.gaszero.relayer.repository;

import dao.gaszero.relayer.model.FundingHistory;

import java.time.Instant;
import java.util.Optional;

/**
 * Sponsorship history keyed by chain and user address.
 */
public interface FundingHistoryRepository {

    Optional<FundingHistory> find(String key);

    void save(String key, FundingHistory history);

    void delete(String key);

    /**
     * Removes histories whose last funding happened before {@code cutoff}.
     *
     * @return number of entries removed
     */
    int evictFundedBefore(Instant cutoff);

    int count();
}
