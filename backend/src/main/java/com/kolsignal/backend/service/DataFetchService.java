package com.kolsignal.backend.service;

import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs upstream calls off the caller's thread with a per-call time limit. A failed,
 * timed out or null-returning call completes with {@code Optional.empty()}; callers
 * decide whether empty means fail-open or fail-closed.
 */
@Service
@Slf4j
public class DataFetchService {

    private final TimeLimiter fetchTimeLimiter;
    private final Executor fetchExecutor;
    private final ScheduledExecutorService fetchTimeoutScheduler;

    public DataFetchService(TimeLimiter fetchTimeLimiter,
                            @Qualifier("fetchExecutor") Executor fetchExecutor,
                            @Qualifier("fetchTimeoutScheduler") ScheduledExecutorService fetchTimeoutScheduler) {
        this.fetchTimeLimiter = fetchTimeLimiter;
        this.fetchExecutor = fetchExecutor;
        this.fetchTimeoutScheduler = fetchTimeoutScheduler;
    }

    public <T> CompletableFuture<Optional<T>> fetchAsync(String source, String tokenAddress, Supplier<T> call) {
        return fetchTimeLimiter.executeCompletionStage(
                        fetchTimeoutScheduler,
                        () -> submit(call))
                .toCompletableFuture()
                .thenApply(Optional::ofNullable)
                .exceptionally(ex -> {
                    Throwable cause = unwrap(ex);
                    if (cause instanceof TimeoutException) {
                        log.warn("Fetch {} timed out for {} after {}", source, tokenAddress,
                                fetchTimeLimiter.getTimeLimiterConfig().getTimeoutDuration());
                    } else {
                        log.warn("Fetch {} failed for {}: {}", source, tokenAddress, cause.getMessage(), cause);
                    }
                    return Optional.empty();
                });
    }

    /**
     * When the returned future is completed from outside (the time limiter's timeout) while
     * the call is still running, the worker thread is interrupted if the limiter is set to
     * cancel running futures. A saturated executor completes the future exceptionally.
     */
    private <T> CompletableFuture<T> submit(Supplier<T> call) {
        CompletableFuture<T> future = new CompletableFuture<>();
        AtomicBoolean callReturned = new AtomicBoolean();
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                T value = call.get();
                callReturned.set(true);
                future.complete(value);
            } catch (Throwable t) {
                callReturned.set(true);
                future.completeExceptionally(t);
            }
            return null;
        });
        boolean interruptOnTimeout = fetchTimeLimiter.getTimeLimiterConfig().shouldCancelRunningFuture();
        future.whenComplete((value, ex) -> {
            if (ex != null && interruptOnTimeout && !callReturned.get()) {
                task.cancel(true);
            }
        });
        try {
            fetchExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            callReturned.set(true);
            future.completeExceptionally(e);
        }
        return future;
    }

    public <T> Optional<T> fetch(String source, String tokenAddress, Supplier<T> call) {
        return fetchAsync(source, tokenAddress, call).join();
    }

    private Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
