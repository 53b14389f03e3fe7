package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.RelayErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChainExecutionQueueTest {

    private ChainExecutionQueue sepolia;
    private ChainExecutionQueue base;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        sepolia = new ChainExecutionQueue("eth-sepolia");
        base = new ChainExecutionQueue("base-sepolia");
        callers = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        sepolia.shutdown();
        base.shutdown();
        callers.shutdownNow();
    }

    @Test
    @DisplayName("Flows on one chain run strictly one after another while other chains keep going")
    void serializesPerChain() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);

        CompletableFuture<String> first = CompletableFuture.supplyAsync(() -> sepolia.run(() -> {
            events.add("first:start");
            firstStarted.countDown();
            await(releaseFirst);
            events.add("first:end");
            return "first";
        }), callers);
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

        CompletableFuture<String> second = CompletableFuture.supplyAsync(() -> sepolia.run(() -> {
            events.add("second:start");
            return "second";
        }), callers);

        // Another chain's queue is not held up by the blocked one.
        assertEquals("base", base.run(() -> "base"));
        Thread.sleep(200);
        assertFalse(second.isDone());
        assertEquals(List.of("first:start"), events);

        releaseFirst.countDown();

        assertEquals("first", first.get(5, TimeUnit.SECONDS));
        assertEquals("second", second.get(5, TimeUnit.SECONDS));
        assertEquals(List.of("first:start", "first:end", "second:start"), events);
    }

    @Test
    void runsOnNamedThread() {
        assertEquals("relay-eth-sepolia", sepolia.run(() -> Thread.currentThread().getName()));
    }

    @Test
    @DisplayName("Exceptions from a flow reach the caller unchanged and the queue keeps serving")
    void rethrowsRuntimeExceptions() {
        RelayException ex = assertThrows(RelayException.class, () -> sepolia.run(() -> {
            throw new RelayException(RelayErrorKind.TRANSACTION_REVERTED, "Pull reverted");
        }));

        assertEquals(RelayErrorKind.TRANSACTION_REVERTED, ex.getKind());
        assertEquals(1, sepolia.run(() -> 1));
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
