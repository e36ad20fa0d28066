package io.github.hotbrkm.mailclient.email.send;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal with an optional deadline, passed through connect, authentication and send.
 * <p>
 * When the token is cancelled, either explicitly or because its deadline passed, all registered
 * callbacks run once. The SMTP client registers a callback that closes the socket so blocked I/O
 * fails promptly, and reports the failure as a timeout.
 */
@Slf4j
public final class CancellationToken {

    private static final ScheduledThreadPoolExecutor DEADLINE_SCHEDULER = createScheduler();

    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile boolean deadlineExceeded;
    private final ScheduledFuture<?> deadlineTask;

    private CancellationToken(Instant deadline) {
        this.deadline = deadline;
        if (deadline != null) {
            long delayMillis = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
            this.deadlineTask = DEADLINE_SCHEDULER.schedule(this::expire, delayMillis, TimeUnit.MILLISECONDS);
        } else {
            this.deadlineTask = null;
        }
    }

    private static ScheduledThreadPoolExecutor createScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "mail-client-deadline");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * Returns a token without deadline that is only cancelled by {@link #cancel()}.
     */
    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        return new CancellationToken(Instant.now().plus(timeout));
    }

    public static CancellationToken withDeadline(Instant deadline) {
        return new CancellationToken(Objects.requireNonNull(deadline, "deadline must not be null"));
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            if (deadlineTask != null) {
                deadlineTask.cancel(false);
            }
            for (Runnable callback : callbacks) {
                runCallback(callback);
            }
        }
    }

    /**
     * Drops the pending deadline without cancelling the token. Called once the guarded operation has
     * finished, so finished operations do not leave deadline tasks queued until they expire.
     */
    public void release() {
        if (deadlineTask != null) {
            deadlineTask.cancel(false);
        }
    }

    boolean isDeadlinePending() {
        return deadlineTask != null && !deadlineTask.isDone();
    }

    private void expire() {
        deadlineExceeded = true;
        cancel();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded || (deadline != null && !Instant.now().isBefore(deadline));
    }

    /**
     * Returns the milliseconds left until the deadline, {@link Long#MAX_VALUE} without deadline,
     * or 0 once cancelled.
     */
    public long remainingMillis() {
        if (isCancelled()) {
            return 0;
        }
        if (deadline == null) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
    }

    public String describe() {
        if (deadlineExceeded) {
            return "deadline exceeded";
        }
        return isCancelled() ? "operation cancelled" : "active";
    }

    /**
     * Registers a callback run on cancellation. If the token is already cancelled the callback runs immediately.
     */
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        callbacks.add(callback);
        if (isCancelled()) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed", e);
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
