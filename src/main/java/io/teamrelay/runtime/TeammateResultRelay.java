package io.teamrelay.runtime;

import io.teamrelay.backend.Backend;
import io.teamrelay.config.RuntimeSettings;
import io.teamrelay.config.TeamRelayConfig;
import io.teamrelay.mailbox.MailboxEngine;
import io.teamrelay.mailbox.MessageDraft;
import io.teamrelay.model.Member;
import io.teamrelay.model.Message;
import io.teamrelay.storage.StoreException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Waits for a one-shot teammate to exit and hands its captured output to the lead's inbox, as a
 * {@code teammate_result} message, or a {@code teammate_timeout} notice when it produced nothing in
 * time.
 */
final class TeammateResultRelay implements AutoCloseable {
    static final int MAX_RESULT_CHARS = 12_000;
    static final String TRUNCATED_MARKER = "\n\n[truncated]";

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final MailboxEngine mailboxes;
    private final Duration checkInterval;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;

    TeammateResultRelay(MailboxEngine mailboxes, RuntimeSettings settings) {
        this.mailboxes = mailboxes;
        this.checkInterval = settings.relayCheckInterval();
        this.timeout = settings.relayTimeout();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "teamrelay-result-relay-" + THREAD_SEQ.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts watching {@code member}'s process. The future completes with the message delivered to
     * the lead.
     */
    CompletableFuture<Message> watch(String team, Member member, Backend backend, Path outputFile) {
        long deadline = System.nanoTime() + timeout.toNanos();
        CompletableFuture<Message> result = new CompletableFuture<>();
        ScheduledFuture<?> loop = scheduler.scheduleWithFixedDelay(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                boolean exited = !backend.healthCheck(member.processHandle()).alive();
                if (exited) {
                    result.complete(relay(team, member, backend, readOutput(outputFile)));
                } else if (System.nanoTime() - deadline >= 0L) {
                    String text = readOutput(outputFile);
                    result.complete(text.isEmpty()
                            ? send(team, member, member.name() + " timed out before producing output.", "teammate_timeout")
                            : relay(team, member, backend, text));
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, checkInterval.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        result.whenComplete((message, failure) -> loop.cancel(false));
        return result;
    }

    private Message relay(String team, Member member, Backend backend, String text) {
        String body = text.isEmpty()
                ? member.name() + " (" + backend.name() + ") finished, but no output was captured."
                : truncate(text);
        return send(team, member, body, "teammate_result");
    }

    private Message send(String team, Member member, String content, String summary) {
        return mailboxes.send(team, TeamRelayConfig.LEAD_NAME,
                MessageDraft.direct(member.name(), content, summary).withColor(member.color()));
    }

    static String truncate(String text) {
        if (text.length() <= MAX_RESULT_CHARS) {
            return text;
        }
        return text.substring(0, MAX_RESULT_CHARS) + TRUNCATED_MARKER;
    }

    private static String readOutput(Path outputFile) {
        if (outputFile == null || !Files.isRegularFile(outputFile)) {
            return "";
        }
        try {
            return Files.readString(outputFile, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw StoreException.io("Failed to read teammate output " + outputFile, e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
