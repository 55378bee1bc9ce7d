package io.teamrelay.backend;

import java.util.Map;

public record SpawnRequest(
        String agentId,
        String name,
        String teamName,
        String prompt,
        String model,
        String agentType,
        String color,
        String cwd,
        String leadSessionId,
        boolean planModeRequired,
        Map<String, String> extra
) {
    public SpawnRequest {
        prompt = prompt == null ? "" : prompt;
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }
}
