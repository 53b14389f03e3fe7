package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.chain.ChainTransaction;
import dao.gaszero.relayer.chain.TxReceipt;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.SupportedChain;
import dao.gaszero.relayer.repository.InMemoryNativeCreditRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;

import static dao.gaszero.relayer.service.TestChains.RELAYER;
import static dao.gaszero.relayer.service.TestChains.USER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NativeDepositServiceTest {

    private static final String HASH = "0x" + "ab".repeat(32);
    private static final BigInteger VALUE = new BigInteger("50000000000000000");

    @Mock
    private ChainClient client;
    @Mock
    private ConfirmationTracker tracker;

    private NativeDepositService service;

    @BeforeEach
    void setUp() {
        RelayerAccountRegistry accounts = RelayerAccountRegistry.of(new RelayerAccount(TestChains.sepolia(), client, null));
        service = new NativeDepositService(accounts, new InMemoryNativeCreditRepository(), tracker);
        lenient().when(client.getAddress()).thenReturn(RELAYER);
        lenient().when(tracker.defaultTimeout()).thenReturn(Duration.ofSeconds(5));
    }

    private void minedDeposit(String from, String to) {
        when(client.getTransaction(HASH)).thenReturn(Optional.of(new ChainTransaction(HASH, from, to, VALUE, BigInteger.TEN)));
        lenient().when(client.waitForReceipt(eq(HASH), any()))
                .thenReturn(Optional.of(new TxReceipt(HASH, true, BigInteger.TEN, BigInteger.valueOf(21_000), null)));
    }

    @Test
    @DisplayName("Verified deposit is credited once")
    void creditsDepositOnce() {
        minedDeposit(USER, RELAYER.toUpperCase().replace("0X", "0x"));

        NativeDepositService.DepositCredit credit = service.register("eth-sepolia", USER, HASH);

        assertEquals(VALUE, credit.credited());
        assertEquals(VALUE, service.available(SupportedChain.ETH_SEPOLIA, USER));

        RelayException again = assertThrows(RelayException.class, () -> service.register("eth-sepolia", USER, HASH));
        assertEquals(RelayErrorKind.VALIDATION_ERROR, again.getKind());
        assertEquals(VALUE, service.available(SupportedChain.ETH_SEPOLIA, USER));
    }

    @Test
    void depositToAnotherAddressIsRejected() {
        minedDeposit(USER, TestChains.RECIPIENT);

        RelayException ex = assertThrows(RelayException.class, () -> service.register("eth-sepolia", USER, HASH));

        assertEquals(RelayErrorKind.VALIDATION_ERROR, ex.getKind());
        assertEquals(BigInteger.ZERO, service.available(SupportedChain.ETH_SEPOLIA, USER));
    }

    @Test
    void depositFromSomeoneElseIsRejected() {
        minedDeposit(TestChains.RECIPIENT, RELAYER);

        assertThrows(RelayException.class, () -> service.register("eth-sepolia", USER, HASH));
    }

    @Test
    void failedDepositIsNotCredited() {
        when(client.getTransaction(HASH)).thenReturn(Optional.of(new ChainTransaction(HASH, USER, RELAYER, VALUE, BigInteger.TEN)));
        when(client.waitForReceipt(eq(HASH), any()))
                .thenReturn(Optional.of(new TxReceipt(HASH, false, BigInteger.TEN, BigInteger.ONE, null)));

        RelayException ex = assertThrows(RelayException.class, () -> service.register("eth-sepolia", USER, HASH));

        assertEquals(RelayErrorKind.TRANSACTION_REVERTED, ex.getKind());
    }

    @Test
    void malformedInput() {
        assertThrows(RelayException.class, () -> service.register("eth-sepolia", USER, "0x1234"));
        assertThrows(RelayException.class, () -> service.register("solana", USER, HASH));
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("Consuming more than the credit is InsufficientBalance; restore puts it back")
    void consumeAndRestore() {
        minedDeposit(USER, RELAYER);
        service.register("eth-sepolia", USER, HASH);

        RelayException ex = assertThrows(RelayException.class,
                () -> service.consume(SupportedChain.ETH_SEPOLIA, USER, VALUE.add(BigInteger.ONE)));
        assertEquals(RelayErrorKind.INSUFFICIENT_BALANCE, ex.getKind());

        service.consume(SupportedChain.ETH_SEPOLIA, USER, VALUE);
        assertEquals(BigInteger.ZERO, service.available(SupportedChain.ETH_SEPOLIA, USER));

        service.restore(SupportedChain.ETH_SEPOLIA, USER, VALUE);
        assertEquals(VALUE, service.available(SupportedChain.ETH_SEPOLIA, USER));
    }
}
