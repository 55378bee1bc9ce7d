package io.teamrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.teamrelay.storage.LockHandle;
import io.teamrelay.storage.LockManager;
import io.teamrelay.storage.StoreException;
import io.teamrelay.util.Hashing;
import io.teamrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only JSONL trail of boundary operations. Each row carries the hash of the previous row, so
 * an edited or dropped line breaks the chain. Appends from several processes are serialized through
 * the lock manager and the chain head is re-read under that lock.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final LockManager locks;
    private final Duration timeout;
    private final Clock clock;
    private final Deque<PendingRow> deferred = new ArrayDeque<>();

    public AuditLogger(Path auditFile, LockManager locks, Duration timeout) {
        this(auditFile, locks, timeout, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, LockManager locks, Duration timeout, Clock clock) {
        this.auditFile = auditFile;
        this.locks = locks;
        this.timeout = timeout;
        this.clock = clock;
    }

    public Path auditFile() {
        return auditFile;
    }

    public String log(AuditEvent event) {
        return append(new PendingRow(event, clock.instant()));
    }

    /**
     * Appends {@code event} after any rows deferred earlier. When the log cannot be written the row
     * is kept in memory, in order, and the failure is returned instead of thrown.
     */
    public Optional<StoreException> logOrDefer(AuditEvent event) {
        PendingRow row = new PendingRow(event, clock.instant());
        synchronized (deferred) {
            try {
                append(row);
                return Optional.empty();
            } catch (StoreException e) {
                deferred.add(row);
                return Optional.of(e);
            }
        }
    }

    /**
     * Writes the rows deferred by {@link #logOrDefer}. They stay queued when this fails.
     */
    public void flushDeferred() {
        if (deferredCount() > 0) {
            append(null);
        }
    }

    public int deferredCount() {
        synchronized (deferred) {
            return deferred.size();
        }
    }

    private String append(PendingRow row) {
        synchronized (deferred) {
            try (LockHandle ignored = locks.acquire(LockManager.lockPathFor(auditFile), timeout)) {
                Files.createDirectories(auditFile.getParent());
                String prevHash = readLastHash();
                while (!deferred.isEmpty()) {
                    prevHash = writeRow(deferred.peek(), prevHash);
                    deferred.poll();
                }
                return row == null ? prevHash : writeRow(row, prevHash);
            } catch (IOException e) {
                throw StoreException.io("Failed to write audit log " + auditFile, e);
            }
        }
    }

    private String writeRow(PendingRow pending, String prevHash) throws IOException {
        AuditEvent event = pending.event();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", pending.at().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("team", event.team());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", prevHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        Files.writeString(auditFile, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        return rowHash;
    }

    public String currentHash() {
        try (LockHandle ignored = locks.acquire(LockManager.lockPathFor(auditFile), timeout)) {
            return readLastHash();
        } catch (IOException e) {
            throw StoreException.io("Failed to read audit log " + auditFile, e);
        }
    }

    /**
     * Recomputes every row hash and checks each {@code prev_hash} link.
     */
    public Verification verify() {
        List<String> lines;
        try (LockHandle ignored = locks.acquire(LockManager.lockPathFor(auditFile), timeout)) {
            lines = Files.exists(auditFile) ? Files.readAllLines(auditFile, StandardCharsets.UTF_8) : List.of();
        } catch (IOException e) {
            throw StoreException.io("Failed to read audit log " + auditFile, e);
        }
        String expectedPrev = "";
        int rows = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            rows++;
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new Verification(false, rows, i + 1, "invalid_json");
            }
            String hash = parsed.path("hash").asText("");
            if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                return new Verification(false, rows, i + 1, "prev_hash_mismatch");
            }
            ObjectNode canonical = parsed.deepCopy();
            canonical.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                return new Verification(false, rows, i + 1, "hash_mismatch");
            }
            expectedPrev = hash;
        }
        return new Verification(true, rows, 0, "");
    }

    private String readLastHash() throws IOException {
        if (!Files.exists(auditFile)) {
            return "";
        }
        String last = "";
        for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        return Jsons.mapper().readTree(last).path("hash").asText("");
    }

    public record AuditEvent(
            String action,
            String actor,
            String team,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public AuditEvent {
            details = details == null ? Map.of() : details;
        }

        public static AuditEvent ok(String action, String actor, String team, String resource, Map<String, Object> details) {
            return new AuditEvent(action, actor, team, resource, "ok", details);
        }

        public static AuditEvent rejected(String action, String actor, String team, String resource, StoreException error) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", error.kind().code());
            details.put("message", error.getMessage());
            return new AuditEvent(action, actor, team, resource, "rejected", details);
        }
    }

    private record PendingRow(AuditEvent event, Instant at) {
    }

    public record Verification(boolean ok, int rows, int brokenLine, String reason) {
    }
}
