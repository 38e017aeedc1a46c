package com.teenagi.agent.resilience;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs a blocking call on a worker pool and bounds how long it may run.
 *
 * The deadline counts from the moment a worker picks the task up, so time
 * spent queued behind other callers is never charged to the task. On timeout
 * the worker is interrupted (cancelRunningFuture) and the caller gets a
 * {@link java.util.concurrent.TimeoutException}. Failures inside the call
 * surface unwrapped, except an InterruptedException raised by the task
 * itself, which arrives as {@link TaskInterruptedException}.
 * {@link InterruptedException} from {@link #call} always means the caller was
 * interrupted; the worker is cancelled before it is rethrown.
 */
@Slf4j
public class TimeLimitedExecutor {

    private static final long START_POLL_MS = 50;

    private final AsyncTaskExecutor executor;
    private final TimeLimiter timeLimiter;
    private final Duration timeout;

    public TimeLimitedExecutor(String name, AsyncTaskExecutor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
        this.timeLimiter = TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }

    public <T> T call(Callable<T> task) throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        Future<T> future = executor.submit(() -> {
            started.countDown();
            try {
                return task.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskInterruptedException(e);
            }
        });
        try {
            awaitStart(started, future);
            return timeLimiter.executeFutureSupplier(() -> future);
        } catch (InterruptedException e) {
            log.debug("Caller interrupted, cancelling [{}] task", timeLimiter.getName());
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static void awaitStart(CountDownLatch started, Future<?> future) throws InterruptedException {
        while (!started.await(START_POLL_MS, TimeUnit.MILLISECONDS)) {
            if (future.isDone()) {
                return;
            }
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    /** The task, not the caller, was interrupted. */
    public static class TaskInterruptedException extends Exception {

        public TaskInterruptedException(InterruptedException cause) {
            super("interrupted" + (cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        }
    }
}
