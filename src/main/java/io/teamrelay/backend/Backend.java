package io.teamrelay.backend;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Lifecycle of agent processes started through one agent CLI. Handles are opaque strings that only
 * the issuing backend interprets.
 */
public interface Backend {
    String name();

    String binaryName();

    boolean isAvailable();

    /**
     * Interactive agents take part in team messaging themselves. One-shot agents run to completion,
     * and their captured output is relayed to the lead.
     */
    default boolean isInteractive() {
        return false;
    }

    List<String> supportedModels();

    String defaultModel();

    /**
     * Maps a generic tier ({@code fast}, {@code balanced}, {@code powerful}) or a concrete model name
     * to the model this CLI expects.
     *
     * @throws IllegalArgumentException when the backend does not know the model
     */
    String resolveModel(String model);

    SpawnResult spawn(SpawnRequest request) throws IOException;

    HealthStatus healthCheck(String handle);

    void kill(String handle);

    /**
     * Asks the process to stop and waits up to {@code timeout}.
     *
     * @return whether the process ended in time
     */
    boolean gracefulShutdown(String handle, Duration timeout);
}
