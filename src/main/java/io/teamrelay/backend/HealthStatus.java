package io.teamrelay.backend;

public record HealthStatus(boolean alive, String detail) {
    public static HealthStatus alive(String detail) {
        return new HealthStatus(true, detail);
    }

    public static HealthStatus dead(String detail) {
        return new HealthStatus(false, detail);
    }
}
