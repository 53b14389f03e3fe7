package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.RelayErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single worker that runs every flow of one relayer account, so its transactions are
 * submitted strictly one after another.
 */
@Slf4j
public class ChainExecutionQueue {

    private final String name;
    private final ExecutorService executor;

    public ChainExecutionQueue(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "relay-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues the task behind every earlier one and blocks until it finished.
     * Runtime exceptions thrown by the task are rethrown unchanged.
     */
    public <T> T run(Supplier<T> task) {
        Future<T> future = executor.submit(task::get);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException(RelayErrorKind.INTERNAL_ERROR, "Interrupted while waiting for " + name + " queue");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Queue {} did not drain in time, interrupting", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
