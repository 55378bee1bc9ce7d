package io.teamrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Directory layout under one coordination root. Every process that shares a root shares its teams.
 */
public final class TeamRelayConfig {
    public static final String DEFAULT_ROOT_DIR = ".teamrelay";
    public static final String SETTINGS_FILE = "teamrelay-settings.json";
    public static final String LEAD_NAME = "team-lead";
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 50L;
    public static final long DEFAULT_POLL_MAX_WAIT_MS = 30_000L;
    public static final long DEFAULT_RELAY_CHECK_INTERVAL_MS = 500L;
    public static final long DEFAULT_RELAY_TIMEOUT_MS = 900_000L;

    private final Path rootDir;

    public TeamRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TeamRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(System.getProperty("user.home"), DEFAULT_ROOT_DIR)
                : Paths.get(root);
        return new TeamRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path teamsRoot() {
        return rootDir.resolve("teams");
    }

    public Path teamDir(String team) {
        return teamsRoot().resolve(team);
    }

    public Path configFile(String team) {
        return teamDir(team).resolve("config.json");
    }

    public Path tasksDir(String team) {
        return teamDir(team).resolve("tasks");
    }

    public Path taskFile(String team, long taskId) {
        return tasksDir(team).resolve(taskId + ".json");
    }

    public Path taskCounterFile(String team) {
        return tasksDir(team).resolve(".highwatermark");
    }

    /**
     * Held across every edit of a team's dependency graph, which may touch several task documents.
     */
    public Path taskGraphLock(String team) {
        return tasksDir(team).resolve(".lock");
    }

    public Path inboxesDir(String team) {
        return teamDir(team).resolve("inboxes");
    }

    public Path inboxFile(String team, String agent) {
        return inboxesDir(team).resolve(agent + ".json");
    }

    public Path runsDir(String team) {
        return teamDir(team).resolve("runs");
    }

    /**
     * Captured output of one run of a one-shot teammate.
     */
    public Path runOutputFile(String team, String agent, long startedAtMs) {
        return runsDir(team).resolve(agent + "-" + startedAtMs + ".out");
    }

    public Path inboxLock(String team) {
        return inboxesDir(team).resolve(".lock");
    }
}
