package io.survivalmesh.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.survivalmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured node event log. Each event is appended as one compact JSON line to an optional
 * file; WARN and ERROR events are also kept in a bounded in-memory ring for health checks.
 *
 * <p>Logging never fails the caller: if the file cannot be written the file sink is turned off
 * and the failure is recorded in the ring.
 */
public final class MeshEventLog {
    private final String nodeId;
    private final int failureCapacity;
    private final Deque<FailureRecord> failures;
    private Path logFile;
    private long eventCount;
    private long failureSeq;

    public MeshEventLog(Path logFile, String nodeId, int failureCapacity) {
        this.nodeId = nodeId == null || nodeId.isBlank() ? "node" : nodeId.trim();
        this.failureCapacity = Math.max(1, failureCapacity);
        this.failures = new ArrayDeque<>();
        this.logFile = logFile;
        if (logFile != null) {
            try {
                Path parent = logFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to initialize event log file: " + logFile, e);
            }
        }
    }

    public static MeshEventLog inMemory(String nodeId, int failureCapacity) {
        return new MeshEventLog(null, nodeId, failureCapacity);
    }

    public synchronized void log(MeshEvent event) {
        long now = System.currentTimeMillis();
        eventCount++;
        if (event.severity() != Severity.INFO) {
            remember(event, now);
        }
        if (logFile == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(now).toString());
        row.put("node", nodeId);
        row.put("severity", event.severity().name());
        row.put("action", event.action());
        row.put("result", event.result());
        row.put("peer", event.peerId());
        row.put("details", event.details());
        try {
            String line = Jsons.compact().writeValueAsString(row) + System.lineSeparator();
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (JsonProcessingException e) {
            remember(MeshEvent.error("event_log.serialize", "failed", null, Map.of("action", event.action(), "error", e.getOriginalMessage())), now);
        } catch (IOException e) {
            Path failedFile = logFile;
            logFile = null;
            remember(MeshEvent.error("event_log.write", "disabled", null, Map.of("file", failedFile.toString(), "error", String.valueOf(e.getMessage()))), now);
        }
    }

    /**
     * Most recent failures first.
     */
    public synchronized List<FailureRecord> recentFailures(int limit) {
        List<FailureRecord> out = new ArrayList<>(Math.min(failures.size(), Math.max(0, limit)));
        Iterator<FailureRecord> it = failures.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized boolean markResolved(String failureId) {
        List<FailureRecord> rebuilt = new ArrayList<>(failures.size());
        boolean found = false;
        for (FailureRecord record : failures) {
            if (!found && record.id().equals(failureId) && !record.resolved()) {
                rebuilt.add(new FailureRecord(record.id(), record.occurredAtMs(), record.event(), true, System.currentTimeMillis()));
                found = true;
            } else {
                rebuilt.add(record);
            }
        }
        if (found) {
            failures.clear();
            failures.addAll(rebuilt);
        }
        return found;
    }

    public synchronized int unresolvedFailureCount() {
        int count = 0;
        for (FailureRecord record : failures) {
            if (!record.resolved()) {
                count++;
            }
        }
        return count;
    }

    public synchronized long eventCount() {
        return eventCount;
    }

    public synchronized Path logFile() {
        return logFile;
    }

    private void remember(MeshEvent event, long now) {
        failureSeq++;
        failures.addLast(new FailureRecord("f" + failureSeq, now, event, false, null));
        while (failures.size() > failureCapacity) {
            failures.removeFirst();
        }
    }

    public enum Severity {
        INFO,
        WARN,
        ERROR
    }

    public record MeshEvent(
            Severity severity,
            String action,
            String result,
            String peerId,
            Map<String, Object> details
    ) {
        public static MeshEvent info(String action, String result, String peerId, Map<String, Object> details) {
            return new MeshEvent(Severity.INFO, action, result, peerId, details == null ? Map.of() : details);
        }

        public static MeshEvent warn(String action, String result, String peerId, Map<String, Object> details) {
            return new MeshEvent(Severity.WARN, action, result, peerId, details == null ? Map.of() : details);
        }

        public static MeshEvent error(String action, String result, String peerId, Map<String, Object> details) {
            return new MeshEvent(Severity.ERROR, action, result, peerId, details == null ? Map.of() : details);
        }
    }

    public record FailureRecord(
            String id,
            long occurredAtMs,
            MeshEvent event,
            boolean resolved,
            Long resolvedAtMs
    ) {
    }
}
