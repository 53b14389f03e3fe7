package dao.gaszero.relayer.scheduler;

import dao.gaszero.relayer.config.SchedulerProperties;
import dao.gaszero.relayer.config.SponsorshipProperties;
import dao.gaszero.relayer.repository.FundingHistoryRepository;
import dao.gaszero.relayer.service.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Drops expired rate-limit windows and aged-out sponsorship history so the in-memory stores stay bounded.
 */
@Slf4j
@Component
public class StateEvictionScheduler {

    private final RateLimiter rateLimiter;
    private final FundingHistoryRepository fundingHistory;
    private final SponsorshipProperties sponsorshipProps;
    private final SchedulerProperties schedulerProps;
    private final Clock clock;

    public StateEvictionScheduler(RateLimiter rateLimiter,
                                  FundingHistoryRepository fundingHistory,
                                  SponsorshipProperties sponsorshipProps,
                                  SchedulerProperties schedulerProps,
                                  Clock clock) {
        this.rateLimiter = rateLimiter;
        this.fundingHistory = fundingHistory;
        this.sponsorshipProps = sponsorshipProps;
        this.schedulerProps = schedulerProps;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${scheduler.eviction.check-interval-ms:60000}")
    public void evictExpired() {
        if (!schedulerProps.getEviction().isEnabled()) {
            return;
        }
        int windows = rateLimiter.evictExpired();
        int histories = fundingHistory.evictFundedBefore(clock.instant().minus(sponsorshipProps.getHistoryRetention()));
        if (windows > 0 || histories > 0) {
            log.debug("Evicted {} rate-limit windows and {} funding histories", windows, histories);
        }
    }
}
