package com.example.media_acquisition.service.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * In-flight registry that collapses concurrent calls for the same key into one execution.
 * <p>
 * Every caller gets its own future. Cancelling it detaches only that caller; the shared work is
 * interrupted once the last caller has left. The entry is removed as soon as the work finishes,
 * whatever the outcome, so the next call for the key starts fresh.
 */
public class SingleFlight<K, V> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SingleFlight.class);

    private final Object lock = new Object();
    private final Map<K, Flight<V>> inFlight = new HashMap<>();

    public CompletableFuture<V> execute(K key, Executor executor, Supplier<V> work) {
        Flight<V> flight;
        boolean leader = false;
        synchronized (lock) {
            flight = inFlight.get(key);
            if (flight == null) {
                flight = newFlight(key, work);
                inFlight.put(key, flight);
                leader = true;
            }
            flight.waiters++;
        }
        if (leader) {
            try {
                executor.execute(flight.task);
            } catch (RejectedExecutionException e) {
                remove(key, flight);
                flight.result.completeExceptionally(e);
            }
        } else {
            LOGGER.debug("joined in-flight work key={}", key);
        }
        return waiterFor(key, flight);
    }

    public int inFlightCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    private Flight<V> newFlight(K key, Supplier<V> work) {
        Flight<V> flight = new Flight<>();
        flight.task = new FutureTask<>(work::get) {
            @Override
            protected void done() {
                remove(key, flight);
                try {
                    flight.result.complete(get());
                } catch (CancellationException e) {
                    flight.result.cancel(false);
                } catch (ExecutionException e) {
                    flight.result.completeExceptionally(e.getCause() != null ? e.getCause() : e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    flight.result.cancel(false);
                }
            }
        };
        return flight;
    }

    private CompletableFuture<V> waiterFor(K key, Flight<V> flight) {
        CompletableFuture<V> waiter = new CompletableFuture<>();
        flight.result.whenComplete((value, error) -> {
            if (error != null) {
                waiter.completeExceptionally(error);
            } else {
                waiter.complete(value);
            }
        });
        waiter.whenComplete((value, error) -> {
            if (waiter.isCancelled()) {
                leave(key, flight);
            }
        });
        return waiter;
    }

    private void leave(K key, Flight<V> flight) {
        synchronized (lock) {
            flight.waiters--;
            if (flight.waiters > 0 || flight.result.isDone()) {
                return;
            }
            if (inFlight.get(key) == flight) {
                inFlight.remove(key);
            }
        }
        LOGGER.info("last waiter left, cancelling in-flight work key={}", key);
        flight.task.cancel(true);
    }

    private void remove(K key, Flight<V> flight) {
        synchronized (lock) {
            if (inFlight.get(key) == flight) {
                inFlight.remove(key);
            }
        }
    }

    private static final class Flight<V> {
        private final CompletableFuture<V> result = new CompletableFuture<>();
        private FutureTask<V> task;
        private int waiters;
    }
}
