package dao.gaszero.relayer.repository;

import dao.gaszero.relayer.model.ReconciliationRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Repository
public class InMemoryReconciliationRepository implements ReconciliationRepository {

    private final List<ReconciliationRecord> records = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void save(ReconciliationRecord record) {
        records.add(record);
    }

    @Override
    public List<ReconciliationRecord> findAll() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    @Override
    public int count() {
        return records.size();
    }
}
