package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.chain.PreparedTransaction;
import dao.gaszero.relayer.chain.TxReceipt;
import dao.gaszero.relayer.config.SponsorshipProperties;
import dao.gaszero.relayer.model.FundingHistory;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.TokenInfo;
import dao.gaszero.relayer.repository.FundingHistoryRepository;
import dao.gaszero.relayer.util.AddressUtil;
import dao.gaszero.relayer.util.TokenAmounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends a user just enough native currency to sign one token approval.
 * <p>
 * Never signs or submits the approval itself. Repeat fundings of the same user on the same chain
 * are spaced by escalating cooldowns: a user funded twice within the longest tier waits that
 * tier before the next funding. The escalation resets once the history ages out.
 */
@Slf4j
@Service
public class GasSponsorshipFunder {

    private final SponsorshipProperties props;
    private final BalanceAllowanceOracle oracle;
    private final ConfirmationTracker tracker;
    private final FundingHistoryRepository historyRepository;
    private final Clock clock;

    private final AtomicLong totalFundings = new AtomicLong();

    public GasSponsorshipFunder(SponsorshipProperties props,
                                BalanceAllowanceOracle oracle,
                                ConfirmationTracker tracker,
                                FundingHistoryRepository historyRepository,
                                Clock clock) {
        this.props = props;
        this.oracle = oracle;
        this.tracker = tracker;
        this.historyRepository = historyRepository;
        this.clock = clock;
    }

    /**
     * Decides (and if needed performs) approval funding so that {@code user} can grant the
     * relayer an allowance of {@code amountNeeded}.
     *
     * @throws RelayException RELAYER_INSUFFICIENT_GAS when the relayer cannot cover the funding,
     *                        or any confirmation failure of the funding transfer
     */
    public SponsorshipDecision ensureAllowance(RelayerAccount account, TokenInfo token, String user,
                                               BigInteger amountNeeded) {
        ChainClient client = account.client();
        String relayer = client.getAddress();

        BigInteger allowance = oracle.allowance(client, token, user, relayer);
        if (allowance.compareTo(amountNeeded) >= 0) {
            return SponsorshipDecision.ready();
        }

        String approveHint = "Insufficient allowance. Approve " + TokenAmounts.toDisplay(amountNeeded, token.decimals())
                + " " + token.symbol() + " for relayer " + relayer;

        BigInteger userNative = oracle.nativeBalance(client, user);
        if (userNative.compareTo(account.config().nativeGasThresholdWei()) >= 0) {
            return new SponsorshipDecision(SponsorshipState.AWAITING_APPROVAL, null, approveHint);
        }

        if (!props.isEnabled()) {
            return new SponsorshipDecision(SponsorshipState.NEEDS_FUNDING, null,
                    approveHint + ". Gas sponsorship is disabled");
        }

        String key = historyKey(account, user);
        Instant now = clock.instant();
        Optional<FundingHistory> history = currentHistory(key, now);
        if (history.isPresent()) {
            Instant nextAllowed = history.get().lastFundedAt().plus(requiredCooldown(history.get()));
            if (now.isBefore(nextAllowed)) {
                log.info("Sponsorship cooldown: chain={}, user={}, fundings={}, nextAllowed={}",
                        account.config().chain(), AddressUtil.shorten(user), history.get().fundingCount(), nextAllowed);
                return new SponsorshipDecision(SponsorshipState.NEEDS_FUNDING, null,
                        approveHint + ". Gas funding cooldown active until " + nextAllowed);
            }
        }

        BigInteger relayerNative = oracle.nativeBalance(client, relayer);
        if (relayerNative.compareTo(props.getFundingAmountWei()) < 0) {
            log.error("Relayer {} on {} cannot sponsor: balance={} wei, needed={} wei",
                    relayer, account.config().chain(), relayerNative, props.getFundingAmountWei());
            throw new RelayException(RelayErrorKind.RELAYER_INSUFFICIENT_GAS, "Relayer has insufficient ETH for gas");
        }

        TxReceipt receipt = tracker.submitAndWait(client,
                PreparedTransaction.valueTransfer("sponsor", user, props.getFundingAmountWei(), props.getGasLimit()));

        FundingHistory updated = history.map(h -> h.next(now)).orElseGet(() -> FundingHistory.first(now));
        historyRepository.save(key, updated);
        totalFundings.incrementAndGet();
        log.info("Sponsored approval gas: chain={}, user={}, amount={} wei, tx={}, fundings={}",
                account.config().chain(), AddressUtil.shorten(user), props.getFundingAmountWei(),
                receipt.transactionHash(), updated.fundingCount());

        return new SponsorshipDecision(SponsorshipState.FUNDED, receipt.transactionHash(),
                "Sent " + TokenAmounts.toDisplay(props.getFundingAmountWei(), 18) + " ETH for gas. Approve "
                        + TokenAmounts.toDisplay(amountNeeded, token.decimals()) + " " + token.symbol()
                        + " for relayer " + relayer + " and retry");
    }

    /**
     * Cooldown counted from the last funding. When the last two fundings were less than the
     * longest tier apart, the longest tier applies; otherwise the tier of the funding count.
     */
    Duration requiredCooldown(FundingHistory history) {
        List<Duration> tiers = props.getCooldowns();
        if (tiers.isEmpty()) return Duration.ZERO;
        Duration longest = tiers.get(tiers.size() - 1);
        if (history.previousFundedAt() != null
                && Duration.between(history.previousFundedAt(), history.lastFundedAt()).compareTo(longest) < 0) {
            return longest;
        }
        return cooldownAfter(history.fundingCount());
    }

    /**
     * Cooldown required after the n-th funding; the last configured tier repeats.
     */
    Duration cooldownAfter(int fundingCount) {
        List<Duration> tiers = props.getCooldowns();
        if (tiers.isEmpty() || fundingCount <= 0) return Duration.ZERO;
        return tiers.get(Math.min(fundingCount, tiers.size()) - 1);
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("enabled", props.isEnabled());
        stats.put("fundingAmountWei", props.getFundingAmountWei().toString());
        stats.put("totalFundings", totalFundings.get());
        stats.put("trackedUsers", historyRepository.count());
        stats.put("cooldowns", props.getCooldowns().stream().map(Duration::toString).toList());
        return stats;
    }

    private Optional<FundingHistory> currentHistory(String key, Instant now) {
        Optional<FundingHistory> history = historyRepository.find(key);
        if (history.isPresent() && !history.get().lastFundedAt().plus(props.getHistoryRetention()).isAfter(now)) {
            historyRepository.delete(key);
            return Optional.empty();
        }
        return history;
    }

    private static String historyKey(RelayerAccount account, String user) {
        return account.config().chain().id() + ":" + AddressUtil.normalize(user);
    }
}
