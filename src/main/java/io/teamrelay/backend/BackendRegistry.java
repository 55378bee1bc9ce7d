package io.teamrelay.backend;

import io.teamrelay.storage.StoreException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class BackendRegistry {
    public static final String PREFERRED_BACKEND = "claude-code";

    private final Map<String, Backend> backends = new ConcurrentHashMap<>();

    /**
     * One process backend per built-in CLI profile, whether or not its binary is installed.
     */
    public static BackendRegistry loadDefaults() {
        BackendRegistry registry = new BackendRegistry();
        for (BackendProfile profile : BackendProfile.defaults()) {
            registry.register(new ProcessBackend(profile));
        }
        return registry;
    }

    public void register(Backend backend) {
        backends.put(backend.name(), backend);
    }

    public Optional<Backend> find(String name) {
        return Optional.ofNullable(backends.get(name));
    }

    public Backend get(String name) {
        return find(name).orElseThrow(() -> {
            String known = String.join(", ", listNames());
            return StoreException.notFound("Backend '" + name + "' not found. Available: "
                    + (known.isEmpty() ? "(none)" : known));
        });
    }

    public List<String> listNames() {
        return backends.keySet().stream().sorted().toList();
    }

    public List<String> listAvailable() {
        return backends.values().stream()
                .filter(Backend::isAvailable)
                .map(Backend::name)
                .sorted()
                .toList();
    }

    public String defaultBackend() {
        List<String> available = listAvailable();
        if (available.contains(PREFERRED_BACKEND)) {
            return PREFERRED_BACKEND;
        }
        if (!available.isEmpty()) {
            return available.get(0);
        }
        throw StoreException.notFound("No backends available. Install at least one agent CLI.");
    }
}
