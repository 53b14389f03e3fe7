package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.chain.ChainClientException;
import dao.gaszero.relayer.chain.PreparedTransaction;
import dao.gaszero.relayer.chain.TransactionSubmissionException;
import dao.gaszero.relayer.chain.TxReceipt;
import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.RelayErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConfirmationTrackerTest {

    private static final PreparedTransaction PUSH = PreparedTransaction.call("push", TestChains.USDC, "0xa9059cbb", 150_000L);

    @Mock
    private ChainClient client;

    private ConfirmationTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ConfirmationTracker(new RelayProperties());
    }

    @AfterEach
    void tearDown() {
        tracker.shutdown();
    }

    @Test
    @DisplayName("Successful receipt is returned")
    void confirmed() {
        when(client.sendTransaction(TestChains.USDC, "0xa9059cbb", BigInteger.ZERO, BigInteger.valueOf(150_000L)))
                .thenReturn("0xabc");
        when(client.waitForReceipt(eq("0xabc"), any()))
                .thenReturn(Optional.of(new TxReceipt("0xabc", true, BigInteger.TEN, BigInteger.ONE, null)));

        TxReceipt receipt = tracker.submitAndWait(client, PUSH, Duration.ofSeconds(5));

        assertEquals("0xabc", receipt.transactionHash());
    }

    @Test
    @DisplayName("Reverted receipt raises TransactionReverted with the reason and hash")
    void reverted() {
        when(client.sendTransaction(anyString(), anyString(), any(), any())).thenReturn("0xabc");
        when(client.waitForReceipt(eq("0xabc"), any()))
                .thenReturn(Optional.of(new TxReceipt("0xabc", false, BigInteger.TEN, BigInteger.ONE, "Too little received")));

        RelayException ex = assertThrows(RelayException.class,
                () -> tracker.submitAndWait(client, PUSH, Duration.ofSeconds(5)));

        assertEquals(RelayErrorKind.TRANSACTION_REVERTED, ex.getKind());
        assertTrue(ex.getMessage().contains("Too little received"));
        assertEquals("0xabc", ex.getTxHash());
    }

    @Test
    @DisplayName("Missing receipt raises ConfirmationTimeout carrying the hash")
    void noReceipt() {
        when(client.sendTransaction(anyString(), anyString(), any(), any())).thenReturn("0xabc");
        when(client.waitForReceipt(eq("0xabc"), any())).thenReturn(Optional.empty());

        RelayException ex = assertThrows(RelayException.class,
                () -> tracker.submitAndWait(client, PUSH, Duration.ofSeconds(5)));

        assertEquals(RelayErrorKind.CONFIRMATION_TIMEOUT, ex.getKind());
        assertEquals("0xabc", ex.getTxHash());
    }

    @Test
    @DisplayName("A wait that overruns the timeout is abandoned")
    void slowWaitIsAbandoned() {
        when(client.sendTransaction(anyString(), anyString(), any(), any())).thenReturn("0xabc");
        when(client.waitForReceipt(eq("0xabc"), any())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return Optional.empty();
        });

        long start = System.currentTimeMillis();
        RelayException ex = assertThrows(RelayException.class,
                () -> tracker.submitAndWait(client, PUSH, Duration.ofMillis(200)));

        assertEquals(RelayErrorKind.CONFIRMATION_TIMEOUT, ex.getKind());
        assertTrue(System.currentTimeMillis() - start < 4_000);
    }

    @Test
    @DisplayName("Node rejecting for funds means the relayer is out of gas")
    void insufficientFunds() {
        when(client.getAddress()).thenReturn(TestChains.RELAYER);
        when(client.sendTransaction(anyString(), anyString(), any(), any()))
                .thenThrow(new TransactionSubmissionException("insufficient funds for gas * price + value"));

        RelayException ex = assertThrows(RelayException.class, () -> tracker.submitAndWait(client, PUSH, Duration.ofSeconds(5)));

        assertEquals(RelayErrorKind.RELAYER_INSUFFICIENT_GAS, ex.getKind());
        verify(client, never()).waitForReceipt(any(), any());
    }

    @Test
    void otherRejection() {
        when(client.sendTransaction(anyString(), anyString(), any(), any()))
                .thenThrow(new TransactionSubmissionException("nonce too low"));

        RelayException ex = assertThrows(RelayException.class, () -> tracker.submitAndWait(client, PUSH, Duration.ofSeconds(5)));

        assertEquals(RelayErrorKind.TRANSACTION_REVERTED, ex.getKind());
        assertTrue(ex.getMessage().contains("rejected"));
    }

    @Test
    void unreachableNode() {
        when(client.sendTransaction(anyString(), anyString(), any(), any()))
                .thenThrow(new ChainClientException("connect timed out"));

        RelayException ex = assertThrows(RelayException.class, () -> tracker.submitAndWait(client, PUSH, Duration.ofSeconds(5)));

        assertEquals(RelayErrorKind.CHAIN_UNAVAILABLE, ex.getKind());
    }
}
