package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.chain.ChainClientException;
import dao.gaszero.relayer.chain.PreparedTransaction;
import dao.gaszero.relayer.chain.TransactionSubmissionException;
import dao.gaszero.relayer.chain.TxReceipt;
import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.RelayErrorKind;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Submits one relayer transaction and waits for its receipt under a deadline.
 */
@Slf4j
@Component
public class ConfirmationTracker {

    private final RelayProperties relayProps;
    private final ExecutorService waiters;

    public ConfirmationTracker(RelayProperties relayProps) {
        this.relayProps = relayProps;
        int threads = Math.max(1, relayProps.getConfirmation().getWaiterThreads());
        this.waiters = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "receipt-waiter");
            t.setDaemon(true);
            return t;
        });
    }

    public Duration defaultTimeout() {
        return Duration.ofMillis(relayProps.getConfirmation().getTimeoutMs());
    }

    public Duration swapTimeout() {
        return Duration.ofMillis(relayProps.getConfirmation().getSwapTimeoutMs());
    }

    public TxReceipt submitAndWait(ChainClient client, PreparedTransaction tx) {
        return submitAndWait(client, tx, defaultTimeout());
    }

    /**
     * @return the successful receipt
     * @throws RelayException RELAYER_INSUFFICIENT_GAS, TRANSACTION_REVERTED, CONFIRMATION_TIMEOUT
     *                        or CHAIN_UNAVAILABLE
     */
    public TxReceipt submitAndWait(ChainClient client, PreparedTransaction tx, Duration timeout) {
        String txHash;
        try {
            txHash = client.sendTransaction(tx.to(), tx.data(), tx.value(), tx.gasLimit());
        } catch (TransactionSubmissionException e) {
            if (e.isInsufficientFunds()) {
                log.error("Relayer {} cannot pay for {}: {}", client.getAddress(), tx.label(), e.getMessage());
                throw new RelayException(RelayErrorKind.RELAYER_INSUFFICIENT_GAS, "Relayer has insufficient ETH for gas");
            }
            throw new RelayException(RelayErrorKind.TRANSACTION_REVERTED, tx.label() + " rejected: " + e.getMessage());
        } catch (ChainClientException e) {
            throw new RelayException(RelayErrorKind.CHAIN_UNAVAILABLE, tx.label() + " not submitted: " + e.getMessage());
        }
        log.info("Submitted {}: tx={}, to={}, gasLimit={}", tx.label(), txHash, tx.to(), tx.gasLimit());

        Future<Optional<TxReceipt>> wait = waiters.submit(() -> client.waitForReceipt(txHash, timeout));
        Optional<TxReceipt> receipt;
        try {
            receipt = wait.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            wait.cancel(true);
            receipt = Optional.empty();
        } catch (InterruptedException e) {
            wait.cancel(true);
            Thread.currentThread().interrupt();
            throw new RelayException(RelayErrorKind.INTERNAL_ERROR, "Interrupted while waiting for " + tx.label(), txHash);
        } catch (ExecutionException e) {
            throw new RelayException(RelayErrorKind.CHAIN_UNAVAILABLE,
                    tx.label() + " receipt lookup failed: " + e.getCause().getMessage(), txHash);
        }

        if (receipt.isEmpty()) {
            log.warn("No receipt for {} within {} ms: tx={}", tx.label(), timeout.toMillis(), txHash);
            throw new RelayException(RelayErrorKind.CONFIRMATION_TIMEOUT,
                    tx.label() + " not confirmed within " + timeout.toSeconds() + "s", txHash);
        }
        TxReceipt r = receipt.get();
        if (!r.success()) {
            String reason = r.revertReason() != null ? r.revertReason() : "execution reverted";
            log.warn("{} reverted: tx={}, reason={}", tx.label(), txHash, reason);
            throw new RelayException(RelayErrorKind.TRANSACTION_REVERTED, tx.label() + " reverted: " + reason, txHash);
        }
        log.info("Confirmed {}: tx={}, block={}, gasUsed={}", tx.label(), txHash, r.blockNumber(), r.gasUsed());
        return r;
    }

    @PreDestroy
    public void shutdown() {
        waiters.shutdownNow();
    }
}
