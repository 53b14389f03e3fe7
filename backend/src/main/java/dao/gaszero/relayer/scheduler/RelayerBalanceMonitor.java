package dao.gaszero.relayer.scheduler;

import dao.gaszero.relayer.config.SchedulerProperties;
import dao.gaszero.relayer.service.RelayHealthService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class RelayerBalanceMonitor {

    private final RelayHealthService healthService;
    private final SchedulerProperties schedulerProps;

    public RelayerBalanceMonitor(RelayHealthService healthService, SchedulerProperties schedulerProps) {
        this.healthService = healthService;
        this.schedulerProps = schedulerProps;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void checkOnStartup() {
        // Startup never fails on an empty or unreachable relayer, it only warns.
        try {
            List<RelayHealthService.RelayerBalance> balances = healthService.balances();
            balances.forEach(b -> log.info("Relayer {} on {}: {} ETH", b.address(), b.chain(), b.display()));
            healthService.alerts(balances).forEach(a -> log.warn("Relayer alert: {}", a));
        } catch (Exception e) {
            log.warn("Startup relayer balance check failed: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${scheduler.balance-monitor.check-interval-ms:300000}")
    public void checkBalances() {
        if (!schedulerProps.getBalanceMonitor().isEnabled()) {
            return;
        }
        List<String> alerts = healthService.alerts(healthService.balances());
        alerts.forEach(a -> log.warn("Relayer alert: {}", a));
    }
}
