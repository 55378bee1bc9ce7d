package io.teamrelay.config;

import io.teamrelay.storage.StoreException;
import io.teamrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables read from {@code teamrelay-settings.json} in the coordination root. Missing keys fall back
 * to the defaults in {@link TeamRelayConfig}.
 */
public record RuntimeSettings(
        long lockTimeoutMs,
        long pollIntervalMs,
        long pollMaxWaitMs,
        long relayCheckIntervalMs,
        long relayTimeoutMs
) {
    public RuntimeSettings {
        lockTimeoutMs = Math.max(1L, lockTimeoutMs);
        pollIntervalMs = Math.max(1L, pollIntervalMs);
        pollMaxWaitMs = Math.max(0L, Math.min(pollMaxWaitMs, TeamRelayConfig.DEFAULT_POLL_MAX_WAIT_MS));
        relayCheckIntervalMs = Math.max(1L, relayCheckIntervalMs);
        relayTimeoutMs = Math.max(0L, relayTimeoutMs);
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                TeamRelayConfig.DEFAULT_LOCK_TIMEOUT_MS,
                TeamRelayConfig.DEFAULT_POLL_INTERVAL_MS,
                TeamRelayConfig.DEFAULT_POLL_MAX_WAIT_MS,
                TeamRelayConfig.DEFAULT_RELAY_CHECK_INTERVAL_MS,
                TeamRelayConfig.DEFAULT_RELAY_TIMEOUT_MS
        );
    }

    public static RuntimeSettings load(Path settingsFile) {
        RuntimeSettings defaults = defaults();
        if (!Files.isRegularFile(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return new RuntimeSettings(
                    file.lockTimeoutMs() == null ? defaults.lockTimeoutMs() : file.lockTimeoutMs(),
                    file.pollIntervalMs() == null ? defaults.pollIntervalMs() : file.pollIntervalMs(),
                    file.pollMaxWaitMs() == null ? defaults.pollMaxWaitMs() : file.pollMaxWaitMs(),
                    file.relayCheckIntervalMs() == null ? defaults.relayCheckIntervalMs() : file.relayCheckIntervalMs(),
                    file.relayTimeoutMs() == null ? defaults.relayTimeoutMs() : file.relayTimeoutMs()
            );
        } catch (IOException e) {
            throw StoreException.io("Failed to read settings " + settingsFile, e);
        }
    }

    public Duration lockTimeout() {
        return Duration.ofMillis(lockTimeoutMs);
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }

    public Duration pollMaxWait() {
        return Duration.ofMillis(pollMaxWaitMs);
    }

    public Duration relayCheckInterval() {
        return Duration.ofMillis(relayCheckIntervalMs);
    }

    public Duration relayTimeout() {
        return Duration.ofMillis(relayTimeoutMs);
    }

    private record SettingsFile(
            Long lockTimeoutMs,
            Long pollIntervalMs,
            Long pollMaxWaitMs,
            Long relayCheckIntervalMs,
            Long relayTimeoutMs
    ) {
    }
}
