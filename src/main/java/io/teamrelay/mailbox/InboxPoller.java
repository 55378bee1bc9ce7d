package io.teamrelay.mailbox;

import io.teamrelay.config.RuntimeSettings;
import io.teamrelay.model.Message;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded long-poll over a mailbox. Each poll is a timed check loop on a shared scheduler; it ends
 * with the first non-empty batch, at the deadline with an empty list, or when the caller cancels the
 * returned future.
 */
public final class InboxPoller implements AutoCloseable {
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final MailboxEngine mailboxes;
    private final Duration interval;
    private final Duration maxWaitCap;
    private final ScheduledExecutorService scheduler;

    public InboxPoller(MailboxEngine mailboxes, RuntimeSettings settings) {
        this(mailboxes, settings.pollInterval(), settings.pollMaxWait());
    }

    public InboxPoller(MailboxEngine mailboxes, Duration interval, Duration maxWaitCap) {
        this.mailboxes = mailboxes;
        this.interval = interval;
        this.maxWaitCap = maxWaitCap;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "teamrelay-inbox-poll-" + THREAD_SEQ.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts polling for messages with an id above {@code sinceId}. A null or negative {@code maxWait}
     * uses the cap; larger values are clamped to it.
     */
    public CompletableFuture<List<Message>> poll(String team, String agent, long sinceId, Duration maxWait) {
        mailboxes.requireTeam(team);
        Duration wait = clamp(maxWait);
        long deadline = System.nanoTime() + wait.toNanos();
        CompletableFuture<List<Message>> result = new CompletableFuture<>();
        ScheduledFuture<?> loop = scheduler.scheduleWithFixedDelay(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                List<Message> fresh = mailboxes.readSince(team, agent, sinceId);
                if (!fresh.isEmpty()) {
                    result.complete(fresh);
                } else if (System.nanoTime() - deadline >= 0L) {
                    result.complete(List.of());
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
        result.whenComplete((messages, failure) -> loop.cancel(false));
        return result;
    }

    /**
     * Blocks until {@link #poll} completes. Interruption cancels the poll and is rethrown as a
     * {@link CancellationException} with the thread's interrupt flag restored.
     */
    public List<Message> await(String team, String agent, long sinceId, Duration maxWait) {
        CompletableFuture<List<Message>> pending = poll(team, agent, sinceId, maxWait);
        try {
            return pending.get();
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Inbox poll interrupted");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Inbox poll failed", e.getCause());
        }
    }

    Duration clamp(Duration requested) {
        if (requested == null || requested.isNegative() || requested.compareTo(maxWaitCap) > 0) {
            return maxWaitCap;
        }
        return requested;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
