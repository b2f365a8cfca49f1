package io.survivalmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.survivalmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class MeshEventLogTest {

    @Test
    void appendsOneJsonLinePerEvent() throws Exception {
        Path root = Files.createTempDirectory("survivalmesh-test-eventlog-");
        try {
            Path file = root.resolve("log").resolve("events.log");
            MeshEventLog log = new MeshEventLog(file, "node-a", 10);
            log.log(MeshEventLog.MeshEvent.info("post.add", "ok", null, Map.of("post_id", "sos0001")));
            log.log(MeshEventLog.MeshEvent.warn("send", "dropped", "node-b", Map.of("attempt", 5)));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            JsonNode first = Jsons.readTree(lines.get(0));
            Assertions.assertEquals("node-a", first.get("node").asText());
            Assertions.assertEquals("INFO", first.get("severity").asText());
            Assertions.assertEquals("post.add", first.get("action").asText());
            Assertions.assertEquals("sos0001", first.get("details").get("post_id").asText());
            JsonNode second = Jsons.readTree(lines.get(1));
            Assertions.assertEquals("node-b", second.get("peer").asText());
            Assertions.assertEquals(5, second.get("details").get("attempt").asInt());
            Assertions.assertEquals(2L, log.eventCount());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void keepsBoundedRingOfFailuresNewestFirst() {
        MeshEventLog log = MeshEventLog.inMemory("node-a", 2);
        log.log(MeshEventLog.MeshEvent.info("send", "ok", null, Map.of()));
        log.log(MeshEventLog.MeshEvent.warn("send", "dropped", null, Map.of("n", 1)));
        log.log(MeshEventLog.MeshEvent.error("send.capacity", "dropped", null, Map.of("n", 2)));
        log.log(MeshEventLog.MeshEvent.warn("chunk.reassemble", "integrity", "node-b", Map.of("n", 3)));

        List<MeshEventLog.FailureRecord> failures = log.recentFailures(10);
        Assertions.assertEquals(2, failures.size());
        Assertions.assertEquals("chunk.reassemble", failures.get(0).event().action());
        Assertions.assertEquals("send.capacity", failures.get(1).event().action());
        Assertions.assertEquals(1, log.recentFailures(1).size());
        Assertions.assertEquals(2, log.unresolvedFailureCount());
    }

    @Test
    void failuresCanBeMarkedResolved() {
        MeshEventLog log = MeshEventLog.inMemory("node-a", 10);
        log.log(MeshEventLog.MeshEvent.warn("send", "dropped", null, Map.of()));
        log.log(MeshEventLog.MeshEvent.warn("send", "dropped", null, Map.of()));
        String id = log.recentFailures(10).get(1).id();

        Assertions.assertTrue(log.markResolved(id));
        Assertions.assertFalse(log.markResolved(id));
        Assertions.assertFalse(log.markResolved("missing"));
        Assertions.assertEquals(1, log.unresolvedFailureCount());
        MeshEventLog.FailureRecord resolved = log.recentFailures(10).get(1);
        Assertions.assertTrue(resolved.resolved());
        Assertions.assertNotNull(resolved.resolvedAtMs());
    }

    @Test
    void unwritableFileDisablesFileSinkWithoutThrowing() throws Exception {
        Path root = Files.createTempDirectory("survivalmesh-test-eventlog-broken-");
        try {
            Path file = root.resolve("events.log");
            MeshEventLog log = new MeshEventLog(file, "node-a", 10);
            Files.createDirectories(file);

            Assertions.assertDoesNotThrow(() -> log.log(MeshEventLog.MeshEvent.info("post.add", "ok", null, Map.of())));
            Assertions.assertNull(log.logFile());
            Assertions.assertEquals("event_log.write", log.recentFailures(1).get(0).event().action());
            Assertions.assertDoesNotThrow(() -> log.log(MeshEventLog.MeshEvent.info("post.add", "ok", null, Map.of())));
            Assertions.assertEquals(2L, log.eventCount());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
