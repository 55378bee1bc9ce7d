package io.teamrelay.backend;

import java.util.List;
import java.util.Map;

/**
 * Static description of one agent CLI: its binary, fixed arguments and model vocabulary.
 */
public record BackendProfile(
        String name,
        String binaryName,
        List<String> baseArgs,
        String modelFlag,
        Map<String, String> modelAliases,
        List<String> supportedModels,
        String defaultModel,
        boolean passThroughUnknownModels,
        boolean interactive
) {
    public BackendProfile {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("backend name cannot be empty");
        }
        if (binaryName == null || binaryName.isBlank()) {
            throw new IllegalArgumentException("backend binary cannot be empty: " + name);
        }
        baseArgs = baseArgs == null ? List.of() : List.copyOf(baseArgs);
        modelAliases = modelAliases == null ? Map.of() : Map.copyOf(modelAliases);
        supportedModels = supportedModels == null ? List.of() : List.copyOf(supportedModels);
    }

    public static BackendProfile claudeCode() {
        return new BackendProfile(
                "claude-code",
                "claude",
                List.of(),
                "--model",
                Map.of(
                        "fast", "haiku",
                        "balanced", "sonnet",
                        "powerful", "opus",
                        "haiku", "haiku",
                        "sonnet", "sonnet",
                        "opus", "opus"
                ),
                List.of("haiku", "sonnet", "opus"),
                "sonnet",
                false,
                true
        );
    }

    public static BackendProfile codex() {
        return new BackendProfile(
                "codex",
                "codex",
                List.of("exec", "--full-auto"),
                "--model",
                Map.of(
                        "fast", "gpt-5.1-codex-mini",
                        "balanced", "gpt-5.3-codex",
                        "powerful", "gpt-5.1-codex-max"
                ),
                List.of("gpt-5.3-codex", "gpt-5.1-codex-max", "gpt-5.1-codex-mini"),
                "gpt-5.3-codex",
                true,
                false
        );
    }

    public static BackendProfile gemini() {
        return new BackendProfile(
                "gemini",
                "gemini",
                List.of(),
                "--model",
                Map.of(
                        "fast", "gemini-2.5-flash",
                        "balanced", "gemini-2.5-pro",
                        "powerful", "gemini-2.5-pro"
                ),
                List.of("gemini-2.5-flash", "gemini-2.5-pro"),
                "gemini-2.5-flash",
                true,
                false
        );
    }

    public static List<BackendProfile> defaults() {
        return List.of(claudeCode(), codex(), gemini());
    }
}
