package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.chain.ContractFunctions;
import dao.gaszero.relayer.chain.PreparedTransaction;
import dao.gaszero.relayer.chain.TxReceipt;
import dao.gaszero.relayer.config.FeeProperties;
import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.ReconciliationRecord;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.RelayResult;
import dao.gaszero.relayer.model.RelayStatus;
import dao.gaszero.relayer.model.SupportedChain;
import dao.gaszero.relayer.model.SwapRequest;
import dao.gaszero.relayer.model.TokenInfo;
import dao.gaszero.relayer.repository.InMemoryReconciliationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static dao.gaszero.relayer.service.TestChains.RELAYER;
import static dao.gaszero.relayer.service.TestChains.ROUTER;
import static dao.gaszero.relayer.service.TestChains.USER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SwapExecutorTest {

    private static final BigInteger HUGE = new BigInteger("1000000000000000000000000");

    @Mock
    private UserFundsCheck fundsCheck;
    @Mock
    private BalanceAllowanceOracle oracle;
    @Mock
    private ConfirmationTracker tracker;
    @Mock
    private NativeDepositService depositService;
    @Mock
    private ChainClient client;

    private final List<PreparedTransaction> sent = new ArrayList<>();
    private final Map<String, RuntimeException> failures = new HashMap<>();

    private InMemoryReconciliationRepository reconciliations;
    private SwapExecutor executor;
    private RelayerAccount account;
    private ChainConfig config;
    private TokenInfo usdc;
    private TokenInfo usdt;
    private TokenInfo eth;

    @BeforeEach
    void setUp() {
        RelayProperties relayProps = new RelayProperties();
        reconciliations = new InMemoryReconciliationRepository();
        executor = new SwapExecutor(fundsCheck, oracle, tracker, new FeeCalculator(new FeeProperties()),
                new FeeTierSelector(relayProps), depositService,
                new ReconciliationAlerts(reconciliations, TestChains.fixedClock()), relayProps);
        config = TestChains.sepolia();
        usdc = TestChains.token(config, "USDC");
        usdt = TestChains.token(config, "USDT");
        eth = TestChains.token(config, "ETH");
        account = new RelayerAccount(config, client, null);
        lenient().when(client.getAddress()).thenReturn(RELAYER);
        lenient().when(tracker.submitAndWait(eq(client), any(PreparedTransaction.class))).thenAnswer(this::mine);
        lenient().when(tracker.submitAndWait(eq(client), any(PreparedTransaction.class), any())).thenAnswer(this::mine);
    }

    private TxReceipt mine(InvocationOnMock invocation) {
        PreparedTransaction tx = invocation.getArgument(1);
        sent.add(tx);
        RuntimeException failure = failures.get(tx.label());
        if (failure != null) {
            throw failure;
        }
        return new TxReceipt("0x" + tx.label(), true, BigInteger.ONE, BigInteger.ONE, null);
    }

    private List<String> labels() {
        return sent.stream().map(PreparedTransaction::label).collect(Collectors.toList());
    }

    private PreparedTransaction sentTx(String label) {
        return sent.stream().filter(t -> t.label().equals(label)).findFirst().orElseThrow();
    }

    private ValidatedSwap swap(TokenInfo in, TokenInfo out, BigInteger amountIn, BigInteger minOut) {
        SwapRequest req = new SwapRequest(SupportedChain.ETH_SEPOLIA, USER, in.symbol(), out.symbol(), "n/a",
                minOut.toString(), null, "0xsig", null, TestChains.NOW + 60, null);
        return new ValidatedSwap(req, config, in, out, amountIn, minOut, in.wrappedNative(), out.wrappedNative(),
                Instant.ofEpochSecond(TestChains.NOW + 60));
    }

    @Test
    @DisplayName("Stable-to-stable swap: fee from input, approve router, output straight to the user")
    void tokenToToken() {
        BigInteger amount = BigInteger.valueOf(100_000_000L);
        BigInteger swapIn = BigInteger.valueOf(99_500_000L);
        BigInteger minOut = BigInteger.valueOf(99_000_000L);
        when(fundsCheck.verify(account, usdc, USER, amount)).thenReturn(Optional.empty());
        when(oracle.allowance(client, usdc, RELAYER, ROUTER)).thenReturn(BigInteger.ZERO);

        RelayResult result = executor.execute(account, swap(usdc, usdt, amount, minOut));

        assertEquals(RelayStatus.SUCCESS, result.status());
        assertEquals("0xswap", result.transactionHash());
        assertEquals(BigInteger.valueOf(500_000L), result.feeCharged());
        assertEquals(swapIn, result.netAmount());
        assertEquals("USDC", result.tokenSymbol());
        assertEquals(List.of("pull", "approve", "swap"), labels());

        assertEquals(ContractFunctions.approve(ROUTER, swapIn), sentTx("approve").data());
        PreparedTransaction swapTx = sentTx("swap");
        assertEquals(ROUTER, swapTx.to());
        assertEquals(ContractFunctions.exactInputSingle(TestChains.USDC, TestChains.USDT, 100, USER, swapIn, minOut),
                swapTx.data());
        assertEquals(BigInteger.valueOf(500_000L), swapTx.gasLimit());
    }

    @Test
    @DisplayName("Existing router allowance skips the approval")
    void sufficientRouterAllowanceSkipsApprove() {
        when(fundsCheck.verify(any(), any(), any(), any())).thenReturn(Optional.empty());
        when(oracle.allowance(client, usdc, RELAYER, ROUTER)).thenReturn(HUGE);

        executor.execute(account, swap(usdc, usdt, BigInteger.valueOf(100_000_000L), BigInteger.ONE));

        assertEquals(List.of("pull", "swap"), labels());
    }

    @Test
    @DisplayName("Router revert after the pull is flagged for reconciliation and nothing is returned")
    void minAmountOutTooHigh() {
        BigInteger amount = BigInteger.valueOf(50_000_000L);
        when(fundsCheck.verify(any(), any(), any(), any())).thenReturn(Optional.empty());
        when(oracle.allowance(client, usdc, RELAYER, ROUTER)).thenReturn(HUGE);
        failures.put("swap", new RelayException(RelayErrorKind.TRANSACTION_REVERTED, "swap reverted: Too little received", "0xswap"));

        RelayResult result = executor.execute(account, swap(usdc, eth, amount, new BigInteger("999000000000000000000")));

        assertEquals(RelayStatus.FAILED, result.status());
        assertEquals(RelayErrorKind.TRANSACTION_REVERTED, result.errorKind());
        assertTrue(result.reconciliationRequired());
        assertEquals("0xpull", result.transactionHash());
        assertEquals(List.of("pull", "swap"), labels());

        ReconciliationRecord record = reconciliations.findAll().get(0);
        assertEquals("USDC", record.tokenSymbol());
        assertEquals(amount, record.amountHeld());
        assertEquals("swap", record.failedStep());
    }

    @Test
    @DisplayName("Wrapped-native output goes to the relayer, is unwrapped and forwarded as native")
    void tokenToNative() {
        BigInteger amount = BigInteger.valueOf(100_000_000L);
        BigInteger received = new BigInteger("30000000000000000");
        when(fundsCheck.verify(any(), any(), any(), any())).thenReturn(Optional.empty());
        when(oracle.allowance(client, usdc, RELAYER, ROUTER)).thenReturn(HUGE);
        when(oracle.tokenBalance(client, eth, RELAYER)).thenReturn(BigInteger.TEN, BigInteger.TEN.add(received));

        RelayResult result = executor.execute(account, swap(usdc, eth, amount, BigInteger.ONE));

        assertEquals(RelayStatus.SUCCESS, result.status());
        assertEquals("0xforward", result.transactionHash());
        assertEquals(List.of("pull", "swap", "unwrap", "forward"), labels());
        assertEquals(ContractFunctions.exactInputSingle(TestChains.USDC, TestChains.WETH, 3000, RELAYER,
                BigInteger.valueOf(99_500_000L), BigInteger.ONE), sentTx("swap").data());
        assertEquals(ContractFunctions.unwrapWithdraw(received), sentTx("unwrap").data());
        PreparedTransaction forward = sentTx("forward");
        assertEquals(USER, forward.to());
        assertEquals(received, forward.value());
    }

    @Test
    @DisplayName("Native input consumes the deposit credit, wraps, swaps and forwards output minus fee")
    void nativeToToken() {
        BigInteger amount = new BigInteger("100000000000000000");
        BigInteger out = BigInteger.valueOf(200_000_000L);
        when(oracle.allowance(client, eth, RELAYER, ROUTER)).thenReturn(BigInteger.ZERO);
        when(oracle.tokenBalance(client, usdc, RELAYER)).thenReturn(BigInteger.ZERO, out);

        RelayResult result = executor.execute(account, swap(eth, usdc, amount, BigInteger.valueOf(190_000_000L)));

        assertEquals(RelayStatus.SUCCESS, result.status());
        assertEquals(BigInteger.valueOf(1_000_000L), result.feeCharged());
        assertEquals(BigInteger.valueOf(199_000_000L), result.netAmount());
        assertEquals("USDC", result.tokenSymbol());
        assertEquals(List.of("wrap", "approve", "swap", "forward"), labels());

        verify(depositService).consume(SupportedChain.ETH_SEPOLIA, USER, amount);
        PreparedTransaction wrap = sentTx("wrap");
        assertEquals(TestChains.WETH, wrap.to());
        assertEquals(amount, wrap.value());
        assertEquals(ContractFunctions.wrapDeposit(), wrap.data());
        assertEquals(ContractFunctions.exactInputSingle(TestChains.WETH, TestChains.USDC, 3000, RELAYER, amount,
                BigInteger.valueOf(190_000_000L)), sentTx("swap").data());
        assertEquals(ContractFunctions.transfer(USER, BigInteger.valueOf(199_000_000L)), sentTx("forward").data());
        verifyNoInteractions(fundsCheck);
    }

    @Test
    @DisplayName("Native input beyond the deposit credit is InsufficientBalance")
    void nativeInputWithoutCredit() {
        doThrow(new RelayException(RelayErrorKind.INSUFFICIENT_BALANCE, "Insufficient balance"))
                .when(depositService).consume(any(), any(), any());

        RelayResult result = executor.execute(account, swap(eth, usdc, BigInteger.TEN, BigInteger.valueOf(190_000_000L)));

        assertEquals(RelayErrorKind.INSUFFICIENT_BALANCE, result.errorKind());
        assertTrue(sent.isEmpty());
    }

    @Test
    @DisplayName("Failed wrap restores the credit")
    void wrapFailureRestoresCredit() {
        BigInteger amount = new BigInteger("100000000000000000");
        failures.put("wrap", new RelayException(RelayErrorKind.TRANSACTION_REVERTED, "wrap reverted", "0xwrap"));

        RelayResult result = executor.execute(account, swap(eth, usdc, amount, BigInteger.valueOf(190_000_000L)));

        assertEquals(RelayErrorKind.TRANSACTION_REVERTED, result.errorKind());
        assertFalse(result.reconciliationRequired());
        verify(depositService).restore(SupportedChain.ETH_SEPOLIA, USER, amount);
        assertEquals(0, reconciliations.count());
    }
}
