package dao.gaszero.relayer.service;

import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.ReconciliationRecord;
import dao.gaszero.relayer.model.SupportedChain;
import dao.gaszero.relayer.util.TokenAmounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class RelayHealthService {

    private final RelayerAccountRegistry accounts;
    private final BalanceAllowanceOracle oracle;
    private final ReconciliationAlerts reconciliation;
    private final RelayProperties relayProps;
    private final Clock clock;

    public RelayHealthService(RelayerAccountRegistry accounts,
                              BalanceAllowanceOracle oracle,
                              ReconciliationAlerts reconciliation,
                              RelayProperties relayProps,
                              Clock clock) {
        this.accounts = accounts;
        this.oracle = oracle;
        this.reconciliation = reconciliation;
        this.relayProps = relayProps;
        this.clock = clock;
    }

    /**
     * @param balanceWei null when the balance could not be read
     */
    public record RelayerBalance(SupportedChain chain, String address, BigInteger balanceWei, String error) {

        public String display() {
            return balanceWei != null ? TokenAmounts.toDisplay(balanceWei, 18) : "unavailable";
        }
    }

    public List<RelayerBalance> balances() {
        List<RelayerBalance> out = new ArrayList<>();
        for (RelayerAccount account : accounts.all()) {
            try {
                out.add(new RelayerBalance(account.config().chain(), account.address(),
                        oracle.nativeBalance(account.client(), account.address()), null));
            } catch (RuntimeException e) {
                log.warn("Cannot read relayer balance on {}: {}", account.config().chain(), e.getMessage());
                out.add(new RelayerBalance(account.config().chain(), account.address(), null, e.getMessage()));
            }
        }
        return out;
    }

    public List<String> alerts(List<RelayerBalance> balances) {
        BigInteger threshold = relayProps.getLowBalanceAlertThreshold()
                .multiply(BigDecimal.TEN.pow(18)).toBigInteger();
        List<String> alerts = new ArrayList<>();
        if (balances.isEmpty()) {
            alerts.add("No relayer accounts configured");
        }
        for (RelayerBalance b : balances) {
            if (b.balanceWei() == null) {
                alerts.add(b.chain() + ": relayer balance unavailable (" + b.error() + ")");
            } else if (b.balanceWei().compareTo(threshold) < 0) {
                alerts.add(b.chain() + ": low relayer balance " + b.display() + " ETH");
            }
        }
        int pending = reconciliation.pendingCount();
        if (pending > 0) {
            alerts.add(pending + " relay(s) need manual reconciliation");
        }
        return alerts;
    }

    public Map<String, Object> snapshot() {
        List<RelayerBalance> balances = balances();
        List<String> alerts = alerts(balances);

        Map<String, Object> relayers = new LinkedHashMap<>();
        for (RelayerBalance b : balances) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("address", b.address());
            entry.put("balance", b.display());
            relayers.put(b.chain().id(), entry);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", alerts.isEmpty() ? "healthy" : "degraded");
        body.put("timestamp", clock.instant().toString());
        body.put("relayers", relayers);
        body.put("alerts", alerts);
        List<ReconciliationRecord> pending = reconciliation.pending();
        body.put("pendingReconciliations", pending.size());
        body.put("reconciliations", pending.stream().map(RelayHealthService::toEntry).collect(Collectors.toList()));
        return body;
    }

    private static Map<String, Object> toEntry(ReconciliationRecord r) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("chain", r.chain().id());
        entry.put("user", r.userAddress());
        entry.put("token", r.tokenSymbol());
        entry.put("amountHeld", String.valueOf(r.amountHeld()));
        entry.put("pullTxHash", r.pullTxHash());
        entry.put("failedStep", r.failedStep());
        entry.put("kind", r.errorKind().name());
        entry.put("detail", r.detail());
        entry.put("recordedAt", r.recordedAt().toString());
        return entry;
    }
}
