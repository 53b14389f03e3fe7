package dao.gaszero.relayer.repository;

import dao.gaszero.relayer.model.ReconciliationRecord;

import java.util.List;

public interface ReconciliationRepository {

    void save(ReconciliationRecord record);

    List<ReconciliationRecord> findAll();

    int count();
}
