package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.chain.ChainClientException;
import dao.gaszero.relayer.chain.ContractFunctions;
import dao.gaszero.relayer.chain.PreparedTransaction;
import dao.gaszero.relayer.chain.TxReceipt;
import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.RelayResult;
import dao.gaszero.relayer.model.SwapRequest;
import dao.gaszero.relayer.model.TokenInfo;
import dao.gaszero.relayer.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Swaps through a Uniswap V3 SwapRouter02 on behalf of the user.
 * <p>
 * Token input: pull, take the fee from the input, swap the rest. Token output goes straight to
 * the user; wrapped-native output goes to the relayer, is unwrapped and forwarded as native currency.
 * <p>
 * Native input: consume the user's deposit credit, wrap it, swap to the relayer, take the fee from
 * the stablecoin output and forward the rest.
 */
@Slf4j
@Component
public class SwapExecutor {

    private final UserFundsCheck fundsCheck;
    private final BalanceAllowanceOracle oracle;
    private final ConfirmationTracker tracker;
    private final FeeCalculator feeCalculator;
    private final FeeTierSelector feeTierSelector;
    private final NativeDepositService depositService;
    private final ReconciliationAlerts alerts;
    private final RelayProperties relayProps;

    public SwapExecutor(UserFundsCheck fundsCheck,
                        BalanceAllowanceOracle oracle,
                        ConfirmationTracker tracker,
                        FeeCalculator feeCalculator,
                        FeeTierSelector feeTierSelector,
                        NativeDepositService depositService,
                        ReconciliationAlerts alerts,
                        RelayProperties relayProps) {
        this.fundsCheck = fundsCheck;
        this.oracle = oracle;
        this.tracker = tracker;
        this.feeCalculator = feeCalculator;
        this.feeTierSelector = feeTierSelector;
        this.depositService = depositService;
        this.alerts = alerts;
        this.relayProps = relayProps;
    }

    public RelayResult execute(RelayerAccount account, ValidatedSwap swap) {
        SwapRequest req = swap.request();
        log.info("Swap start: chain={}, from={}, {} {} -> {}, minOut={}", swap.config().chain(),
                AddressUtil.shorten(req.fromAddress()), swap.amountIn(), swap.tokenIn().symbol(),
                swap.tokenOut().symbol(), swap.minAmountOut());
        if (req.routeData() != null && !req.routeData().isEmpty()) {
            log.debug("Ignoring external route data: {}", req.routeData());
        }
        return swap.nativeInput() ? fromNative(account, swap) : fromToken(account, swap);
    }

    private RelayResult fromToken(RelayerAccount account, ValidatedSwap swap) {
        ChainConfig config = swap.config();
        ChainClient client = account.client();
        String user = swap.request().fromAddress();
        TokenInfo tokenIn = swap.tokenIn();
        TokenInfo tokenOut = swap.tokenOut();
        BigInteger amount = swap.amountIn();

        TxReceipt pull;
        try {
            Optional<RelayResult> blocked = fundsCheck.verify(account, tokenIn, user, amount);
            if (blocked.isPresent()) {
                return blocked.get();
            }
            pull = tracker.submitAndWait(client, PreparedTransaction.call("pull", tokenIn.address(),
                    ContractFunctions.transferFrom(user, client.getAddress(), amount), config.tokenTransferGasLimit()));
        } catch (RelayException e) {
            return RelayResult.failure(e.getKind(), e.getMessage(), e.getTxHash());
        } catch (ChainClientException e) {
            return RelayResult.failure(RelayErrorKind.CHAIN_UNAVAILABLE, e.getMessage());
        }

        Held held = new Held(tokenIn.symbol(), amount, pull.transactionHash(), "approve");
        try {
            BigInteger fee = feeCalculator.fee(amount, false);
            BigInteger swapIn = amount.subtract(fee);
            ensureRouterAllowance(account, tokenIn, swapIn);

            String recipient = swap.nativeOutput() ? client.getAddress() : user;
            BigInteger outBefore = swap.nativeOutput()
                    ? oracle.tokenBalance(client, tokenOut, client.getAddress()) : BigInteger.ZERO;

            held.step = "swap";
            TxReceipt swapped = routerSwap(account, tokenIn, tokenOut, recipient, swapIn, swap.minAmountOut());

            if (!swap.nativeOutput()) {
                log.info("Swap done: chain={}, pull={}, swap={}, fee={} {}", config.chain(),
                        pull.transactionHash(), swapped.transactionHash(), fee, tokenIn.symbol());
                return RelayResult.success(swapped.transactionHash(), fee, swapIn, tokenIn,
                        config.explorerTxUrl(swapped.transactionHash()));
            }

            held.step = "measure";
            BigInteger received = oracle.tokenBalance(client, tokenOut, client.getAddress()).subtract(outBefore);
            held.token = tokenOut.symbol();
            held.amount = received;
            if (received.signum() <= 0) {
                throw new RelayException(RelayErrorKind.INTERNAL_ERROR,
                        "Swap " + swapped.transactionHash() + " delivered no " + tokenOut.symbol());
            }

            held.step = "unwrap";
            tracker.submitAndWait(client, PreparedTransaction.call("unwrap", tokenOut.address(),
                    ContractFunctions.unwrapWithdraw(received), relayProps.getGas().getUnwrap()));

            held.step = "forward";
            TxReceipt forward = tracker.submitAndWait(client, PreparedTransaction.valueTransfer("forward", user,
                    received, relayProps.getGas().getNativeTransfer()));

            log.info("Swap done: chain={}, pull={}, swap={}, forward={}, fee={} {}, native out={} wei", config.chain(),
                    pull.transactionHash(), swapped.transactionHash(), forward.transactionHash(), fee,
                    tokenIn.symbol(), received);
            return RelayResult.success(forward.transactionHash(), fee, swapIn, tokenIn,
                    config.explorerTxUrl(forward.transactionHash()));
        } catch (RuntimeException e) {
            return heldAfterPull(config, user, held, e);
        }
    }

    private RelayResult fromNative(RelayerAccount account, ValidatedSwap swap) {
        ChainConfig config = swap.config();
        ChainClient client = account.client();
        String user = swap.request().fromAddress();
        TokenInfo wrapped = swap.tokenIn();
        TokenInfo tokenOut = swap.tokenOut();
        BigInteger amount = swap.amountIn();

        TxReceipt wrap;
        try {
            depositService.consume(config.chain(), user, amount);
        } catch (RelayException e) {
            return RelayResult.failure(e.getKind(), e.getMessage());
        }
        try {
            wrap = tracker.submitAndWait(client, new PreparedTransaction("wrap", wrapped.address(),
                    ContractFunctions.wrapDeposit(), amount, BigInteger.valueOf(relayProps.getGas().getWrap())));
        } catch (RuntimeException e) {
            depositService.restore(config.chain(), user, amount);
            RelayErrorKind kind = kindOf(e);
            return RelayResult.failure(kind, "Wrapping deposited " + wrapped.symbol() + " failed: " + e.getMessage());
        }

        Held held = new Held(wrapped.symbol(), amount, wrap.transactionHash(), "approve");
        try {
            ensureRouterAllowance(account, wrapped, amount);
            BigInteger outBefore = oracle.tokenBalance(client, tokenOut, client.getAddress());

            held.step = "swap";
            TxReceipt swapped = routerSwap(account, wrapped, tokenOut, client.getAddress(), amount, swap.minAmountOut());

            held.step = "measure";
            BigInteger received = oracle.tokenBalance(client, tokenOut, client.getAddress()).subtract(outBefore);
            held.token = tokenOut.symbol();
            held.amount = received;
            BigInteger fee = feeCalculator.fee(received, false);
            if (received.compareTo(fee) <= 0) {
                throw new RelayException(RelayErrorKind.INTERNAL_ERROR,
                        "Swap " + swapped.transactionHash() + " output " + received + " does not cover the fee " + fee);
            }
            BigInteger net = received.subtract(fee);

            held.step = "forward";
            TxReceipt forward = tracker.submitAndWait(client, PreparedTransaction.call("forward", tokenOut.address(),
                    ContractFunctions.transfer(user, net), config.tokenTransferGasLimit()));

            log.info("Native swap done: chain={}, wrap={}, swap={}, forward={}, fee={}, net={} {}", config.chain(),
                    wrap.transactionHash(), swapped.transactionHash(), forward.transactionHash(), fee, net,
                    tokenOut.symbol());
            return RelayResult.success(forward.transactionHash(), fee, net, tokenOut,
                    config.explorerTxUrl(forward.transactionHash()));
        } catch (RuntimeException e) {
            return heldAfterPull(config, user, held, e);
        }
    }

    /**
     * Approves the router for {@code needed} unless the current allowance already covers it.
     */
    void ensureRouterAllowance(RelayerAccount account, TokenInfo token, BigInteger needed) {
        ChainClient client = account.client();
        String router = account.config().routerAddress();
        BigInteger current = oracle.allowance(client, token, client.getAddress(), router);
        if (current.compareTo(needed) >= 0) {
            log.debug("Router allowance sufficient: token={}, allowance={}, needed={}", token.symbol(), current, needed);
            return;
        }
        tracker.submitAndWait(client, PreparedTransaction.call("approve", token.address(),
                ContractFunctions.approve(router, needed), relayProps.getGas().getApprove()));
    }

    private TxReceipt routerSwap(RelayerAccount account, TokenInfo tokenIn, TokenInfo tokenOut, String recipient,
                                 BigInteger amountIn, BigInteger minAmountOut) {
        int feeTier = feeTierSelector.select(tokenIn, tokenOut);
        String data = ContractFunctions.exactInputSingle(tokenIn.address(), tokenOut.address(), feeTier,
                recipient, amountIn, minAmountOut);
        return tracker.submitAndWait(account.client(),
                PreparedTransaction.call("swap", account.config().routerAddress(), data, relayProps.getGas().getSwap()),
                tracker.swapTimeout());
    }

    private RelayResult heldAfterPull(ChainConfig config, String user, Held held, RuntimeException e) {
        RelayErrorKind kind = kindOf(e);
        alerts.raise(config.chain(), user, held.token, held.amount, held.pullTxHash, held.step, kind, e.getMessage());
        return RelayResult.partialFailure(kind,
                "Swap failed at " + held.step + ": " + e.getMessage() + ". Funds held for reconciliation",
                held.pullTxHash);
    }

    private static RelayErrorKind kindOf(RuntimeException e) {
        if (e instanceof RelayException) {
            return ((RelayException) e).getKind();
        }
        if (e instanceof ChainClientException) {
            return RelayErrorKind.CHAIN_UNAVAILABLE;
        }
        log.error("Unexpected swap failure", e);
        return RelayErrorKind.INTERNAL_ERROR;
    }

    /**
     * What the relayer currently holds on the user's behalf, and the step being attempted.
     */
    private static final class Held {
        private String token;
        private BigInteger amount;
        private final String pullTxHash;
        private String step;

        private Held(String token, BigInteger amount, String pullTxHash, String step) {
            this.token = token;
            this.amount = amount;
            this.pullTxHash = pullTxHash;
            this.step = step;
        }
    }
}
