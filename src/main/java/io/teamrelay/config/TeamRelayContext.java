package io.teamrelay.config;

import io.teamrelay.storage.DocumentStore;
import io.teamrelay.storage.FileDocumentStore;
import io.teamrelay.storage.InMemoryDocumentStore;

import java.nio.file.Path;

/**
 * Everything a component needs to reach shared state: the root layout, the store over it, and the
 * tunables. Created once per process (or per test) and passed to each engine.
 */
public record TeamRelayContext(TeamRelayConfig config, DocumentStore store, RuntimeSettings settings) {

    public static TeamRelayContext open(TeamRelayConfig config) {
        return new TeamRelayContext(config, new FileDocumentStore(), RuntimeSettings.load(config.settingsFile()));
    }

    public static TeamRelayContext inMemory(Path root) {
        return new TeamRelayContext(new TeamRelayConfig(root), new InMemoryDocumentStore(), RuntimeSettings.defaults());
    }

    public TeamRelayContext withSettings(RuntimeSettings replacement) {
        return new TeamRelayContext(config, store, replacement);
    }
}
