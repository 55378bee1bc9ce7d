package io.teamrelay.backend;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts the agent CLI as a direct child process and tracks it by pid. The prompt is written to the
 * child's stdin; its output goes to {@code extra.output_path} when given and is discarded otherwise.
 * Handles look like {@code pid:1234}.
 */
public final class ProcessBackend implements Backend {
    public static final String OUTPUT_PATH_KEY = "output_path";
    private static final String HANDLE_PREFIX = "pid:";

    private final BackendProfile profile;

    public ProcessBackend(BackendProfile profile) {
        this.profile = profile;
    }

    @Override
    public String name() {
        return profile.name();
    }

    @Override
    public String binaryName() {
        return profile.binaryName();
    }

    @Override
    public boolean isAvailable() {
        return discoverBinary().isPresent();
    }

    @Override
    public boolean isInteractive() {
        return profile.interactive();
    }

    @Override
    public List<String> supportedModels() {
        return profile.supportedModels();
    }

    @Override
    public String defaultModel() {
        return profile.defaultModel();
    }

    @Override
    public String resolveModel(String model) {
        if (model == null || model.isBlank()) {
            return profile.defaultModel();
        }
        String alias = profile.modelAliases().get(model);
        if (alias != null) {
            return alias;
        }
        if (profile.supportedModels().contains(model) || profile.passThroughUnknownModels()) {
            return model;
        }
        throw new IllegalArgumentException("Unsupported model '" + model + "' for " + profile.name()
                + ". Supported: " + String.join(", ", profile.supportedModels()));
    }

    public List<String> buildCommand(SpawnRequest request) {
        Path binary = discoverBinary().orElseThrow(() -> new IllegalStateException(
                "Binary '" + profile.binaryName() + "' for backend " + profile.name() + " not found on PATH"));
        List<String> command = new ArrayList<>();
        command.add(binary.toString());
        command.addAll(profile.baseArgs());
        if (profile.modelFlag() != null) {
            command.add(profile.modelFlag());
            command.add(resolveModel(request.model()));
        }
        return command;
    }

    @Override
    public SpawnResult spawn(SpawnRequest request) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(buildCommand(request));
        pb.redirectErrorStream(true);
        String outputPath = request.extra().get(OUTPUT_PATH_KEY);
        if (outputPath == null || outputPath.isBlank()) {
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        } else {
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(new File(outputPath)));
        }
        if (request.cwd() != null && !request.cwd().isBlank()) {
            pb.directory(new File(request.cwd()));
        }
        Map<String, String> env = pb.environment();
        env.put("TEAMRELAY_TEAM", nullToEmpty(request.teamName()));
        env.put("TEAMRELAY_AGENT_NAME", nullToEmpty(request.name()));
        env.put("TEAMRELAY_AGENT_ID", nullToEmpty(request.agentId()));

        Process process = pb.start();
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(request.prompt().getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new IOException("Failed to hand prompt to " + profile.binaryName(), e);
        }
        return new SpawnResult(HANDLE_PREFIX + process.pid(), profile.name());
    }

    @Override
    public HealthStatus healthCheck(String handle) {
        Optional<Long> pid = parsePid(handle);
        if (pid.isEmpty()) {
            return HealthStatus.dead("unrecognized handle: " + handle);
        }
        boolean alive = ProcessHandle.of(pid.get()).map(ProcessHandle::isAlive).orElse(false);
        return alive
                ? HealthStatus.alive("pid " + pid.get() + " running")
                : HealthStatus.dead("pid " + pid.get() + " not running");
    }

    @Override
    public void kill(String handle) {
        parsePid(handle).flatMap(ProcessHandle::of).ifPresent(ProcessHandle::destroyForcibly);
    }

    @Override
    public boolean gracefulShutdown(String handle, Duration timeout) {
        Optional<ProcessHandle> process = parsePid(handle).flatMap(ProcessHandle::of);
        if (process.isEmpty() || !process.get().isAlive()) {
            return true;
        }
        process.get().destroy();
        try {
            process.get().onExit().get(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.get().isAlive();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Waiting for " + handle + " failed", e.getCause());
        }
    }

    Optional<Path> discoverBinary() {
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir).resolve(profile.binaryName());
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    static Optional<Long> parsePid(String handle) {
        if (handle == null || !handle.startsWith(HANDLE_PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(handle.substring(HANDLE_PREFIX.length())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String nullToEmpty(String raw) {
        return raw == null ? "" : raw;
    }
}
