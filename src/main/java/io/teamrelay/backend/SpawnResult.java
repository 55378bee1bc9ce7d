package io.teamrelay.backend;

public record SpawnResult(String processHandle, String backendType) {
}
