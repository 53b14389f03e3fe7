package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.ReconciliationRecord;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.SupportedChain;
import dao.gaszero.relayer.repository.ReconciliationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * Records user funds stranded in a relayer account after a flow failed half way.
 * Every record is also logged at ERROR on the {@code RECONCILIATION} logger for alert routing.
 */
@Component
public class ReconciliationAlerts {

    private static final Logger RECONCILIATION = LoggerFactory.getLogger("RECONCILIATION");

    private final ReconciliationRepository repository;
    private final Clock clock;

    public ReconciliationAlerts(ReconciliationRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public ReconciliationRecord raise(SupportedChain chain, String user, String tokenSymbol, BigInteger amountHeld,
                                      String pullTxHash, String failedStep, RelayErrorKind kind, String detail) {
        ReconciliationRecord record = new ReconciliationRecord(chain, user, tokenSymbol, amountHeld,
                pullTxHash, failedStep, kind, detail, clock.instant());
        repository.save(record);
        RECONCILIATION.error("Funds held for reconciliation: chain={}, user={}, token={}, amount={}, pullTx={}, failedStep={}, kind={}, detail={}",
                chain, user, tokenSymbol, amountHeld, pullTxHash, failedStep, kind, detail);
        return record;
    }

    public List<ReconciliationRecord> pending() {
        return repository.findAll();
    }

    public int pendingCount() {
        return repository.count();
    }
}
