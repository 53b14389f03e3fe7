package dao.gaszero.relayer.repository;

import dao.gaszero.relayer.model.FundingHistory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryFundingHistoryRepository implements FundingHistoryRepository {

    private final Map<String, FundingHistory> histories = new ConcurrentHashMap<>();

    @Override
    public Optional<FundingHistory> find(String key) {
        return Optional.ofNullable(histories.get(key));
    }

    @Override
    public void save(String key, FundingHistory history) {
        histories.put(key, history);
    }

    @Override
    public void delete(String key) {
        histories.remove(key);
    }

    @Override
    public int evictFundedBefore(Instant cutoff) {
        int before = histories.size();
        histories.values().removeIf(h -> h.lastFundedAt().isBefore(cutoff));
        return before - histories.size();
    }

    @Override
    public int count() {
        return histories.size();
    }
}
