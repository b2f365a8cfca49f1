package io.survivalmesh.cli;

import io.survivalmesh.chunk.ChunkingException;
import io.survivalmesh.chunk.MessageChunk;
import io.survivalmesh.chunk.MessageChunker;
import io.survivalmesh.codec.CorruptPayloadException;
import io.survivalmesh.codec.PayloadCodec;
import io.survivalmesh.config.GossipSettings;
import io.survivalmesh.config.SurvivalMeshConfig;
import io.survivalmesh.gossip.GossipEngine;
import io.survivalmesh.model.PostCategory;
import io.survivalmesh.model.PostKind;
import io.survivalmesh.model.SurvivalPost;
import io.survivalmesh.observability.MeshEventLog;
import io.survivalmesh.observability.PrometheusFormatter;
import io.survivalmesh.transport.UdpTransport;
import io.survivalmesh.util.Ids;
import io.survivalmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "survivalmesh",
        mixinStandardHelpOptions = true,
        description = "SurvivalMesh gossip node CLI",
        subcommands = {
                SurvivalMeshCommand.NodeCommand.class,
                SurvivalMeshCommand.SimulateCommand.class,
                SurvivalMeshCommand.ChunkCommand.class,
                SurvivalMeshCommand.CodecCommand.class,
                SurvivalMeshCommand.SettingsCommand.class
        }
)
public final class SurvivalMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Node data root directory (settings file, event log)", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: node | simulate | chunk | codec | settings");
    }

    SurvivalMeshConfig config() {
        return SurvivalMeshConfig.fromRoot(root);
    }

    GossipSettings settings() {
        return GossipSettings.load(config().settingsFile());
    }

    @Command(name = "settings", description = "Print effective gossip settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        SurvivalMeshCommand parent;

        @Override
        public Integer call() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("settingsFile", parent.config().settingsFile().toString());
            out.put("settingsFileExists", Files.exists(parent.config().settingsFile()));
            out.put("settings", parent.settings());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "codec", description = "Apply a codec operation: size | compress | decompress | checksum")
    static final class CodecCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Operation: size | compress | decompress | checksum")
        String operation;

        @Parameters(index = "1", description = "Input text")
        String text;

        @Override
        public Integer call() {
            String op = operation.trim().toLowerCase(Locale.ROOT);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("operation", op);
            switch (op) {
                case "size" -> out.put("bytes", PayloadCodec.size(text));
                case "checksum" -> out.put("checksum", PayloadCodec.checksum(text));
                case "compress" -> {
                    String encoded = PayloadCodec.compress(text);
                    out.put("inputBytes", PayloadCodec.size(text));
                    out.put("outputBytes", PayloadCodec.size(encoded));
                    out.put("output", encoded);
                }
                case "decompress" -> {
                    try {
                        out.put("output", PayloadCodec.decompress(text));
                    } catch (CorruptPayloadException e) {
                        System.err.println("Corrupt payload: " + e.getMessage());
                        return 1;
                    }
                }
                default -> {
                    System.err.println("Unknown codec operation: " + operation);
                    return 2;
                }
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "chunk", description = "Split text into radio-sized chunks and verify reassembly")
    static final class ChunkCommand implements Callable<Integer> {
        @ParentCommand
        SurvivalMeshCommand parent;

        @Option(names = {"--max-unit"}, defaultValue = "-1", description = "Max serialized chunk bytes (-1 uses settings)")
        int maxUnit;

        @Option(names = {"--file"}, description = "Read the message from a UTF-8 file instead of the argument")
        String file;

        @Parameters(index = "0", arity = "0..1", description = "Message text")
        String text;

        @Override
        public Integer call() throws IOException {
            String message = file == null || file.isBlank()
                    ? (text == null ? "" : text)
                    : Files.readString(Path.of(file.trim()), StandardCharsets.UTF_8);
            GossipSettings settings = parent.settings();
            int unit = maxUnit <= 0 ? settings.maxPayloadBytes() : maxUnit;
            List<MessageChunk> chunks;
            try {
                chunks = MessageChunker.split(message, unit, settings.chunkOverheadBytes());
            } catch (ChunkingException e) {
                System.err.println("Cannot chunk message (" + e.reason() + "): " + e.getMessage());
                return 1;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("messageBytes", PayloadCodec.size(message));
            out.put("maxUnitBytes", unit);
            out.put("totalChunks", chunks.size());
            out.put("reassembles", message.equals(MessageChunker.reassemble(chunks)));
            out.put("chunks", chunks);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "simulate", description = "Run an in-memory line of nodes until every node has every post")
    static final class SimulateCommand implements Callable<Integer> {
        @ParentCommand
        SurvivalMeshCommand parent;

        @Option(names = {"--nodes"}, defaultValue = "4", description = "Nodes in the line; reach is bounded by max hops")
        int nodes;

        @Option(names = {"--inter-send-ms"}, defaultValue = "5", description = "Inter-send delay for the simulated radios")
        long interSendMs;

        @Option(names = {"--timeout-ms"}, defaultValue = "10000", description = "Convergence deadline per phase")
        long timeoutMs;

        @Option(names = {"--partition"}, defaultValue = "false", description = "Cut and heal the middle link")
        boolean partition;

        @Option(names = {"--metrics"}, defaultValue = "false", description = "Print Prometheus text instead of JSON")
        boolean metrics;

        @Override
        public Integer call() throws Exception {
            GossipSettings base = parent.settings();
            GossipSettings settings = base.withTiming(base.retryBackoffMs(), interSendMs);
            MeshSimulation.SimulationOutcome outcome = new MeshSimulation(nodes, settings, timeoutMs, partition).run();
            if (metrics) {
                System.out.print(PrometheusFormatter.format(outcome.stats()));
            } else {
                System.out.println(Jsons.toJson(outcome));
            }
            return outcome.converged() ? 0 : 3;
        }
    }

    @Command(name = "node", description = "Run a UDP gossip node")
    static final class NodeCommand implements Callable<Integer> {
        @ParentCommand
        SurvivalMeshCommand parent;

        @Option(names = {"--node-id"}, description = "Local node id (generated when absent)")
        String nodeId;

        @Option(names = {"--name"}, defaultValue = SurvivalMeshConfig.DEFAULT_DISPLAY_NAME, description = "Advertised display name")
        String displayName;

        @Option(names = {"--bind-port"}, defaultValue = "17888", description = "UDP bind port")
        int bindPort;

        @Option(names = {"--seeds"}, split = ",", description = "Seed endpoints host:port, comma-separated")
        List<String> seeds;

        @Option(names = {"--seeds-file"}, description = "Seed endpoints file (one host:port per line)")
        String seedsFile;

        @Option(names = {"--announce-ms"}, defaultValue = "1000", description = "Hello announcement interval")
        long announceMs;

        @Option(names = {"--peer-timeout-ms"}, defaultValue = "5000", description = "Silence before a peer is considered lost")
        long peerTimeoutMs;

        @Option(names = {"--post-kind"}, description = "Post to publish on start: have | want | sos")
        String postKind;

        @Option(names = {"--post-item"}, description = "Item text of the post to publish")
        String postItem;

        @Option(names = {"--house"}, defaultValue = "1", description = "House number of the post")
        int house;

        @Option(names = {"--category"}, description = "SOS category: medical | safety | fire | other")
        String category;

        @Option(names = {"--duration-ms"}, defaultValue = "0", description = "Run time before exit (0 runs until interrupted)")
        long durationMs;

        @Option(names = {"--stats-interval-ms"}, defaultValue = "5000", description = "Interval between stats lines")
        long statsIntervalMs;

        @Override
        public Integer call() throws Exception {
            SurvivalMeshConfig config = parent.config();
            GossipSettings settings = parent.settings();
            String id = nodeId == null || nodeId.isBlank() ? Ids.newNodeId() : nodeId.trim();
            MeshEventLog eventLog = new MeshEventLog(config.eventLogFile(), id, settings.errorLogCapacity());
            UdpTransport transport = new UdpTransport(
                    bindPort,
                    resolveSeedEndpoints(seeds, seedsFile),
                    settings.maxPayloadBytes(),
                    announceMs,
                    peerTimeoutMs
            );
            try (GossipEngine engine = new GossipEngine(id, displayName, settings, transport, eventLog)) {
                engine.start();
                if (postKind != null && !postKind.isBlank()) {
                    PostKind kind = PostKind.fromCode(postKind.trim());
                    engine.addLocalPost(SurvivalPost.create(kind, postItem, house, PostCategory.fromCode(category)));
                }
                long deadline = durationMs <= 0 ? Long.MAX_VALUE : System.currentTimeMillis() + durationMs;
                long interval = Math.max(100L, statsIntervalMs);
                while (System.currentTimeMillis() < deadline) {
                    Thread.sleep(Math.min(interval, Math.max(1L, deadline - System.currentTimeMillis())));
                    System.out.println(Jsons.toCompactJson(engine.getQueueStats()));
                }
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("nodeId", id);
                out.put("posts", engine.getLocalPosts());
                out.put("peers", engine.getPeerSyncStatus());
                out.put("stats", engine.getQueueStats());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    static List<String> resolveSeedEndpoints(List<String> cliSeeds, String seedsFile) {
        Set<String> unique = new LinkedHashSet<>();
        if (cliSeeds != null) {
            for (String seed : cliSeeds) {
                addSeed(unique, seed);
            }
        }
        if (seedsFile != null && !seedsFile.isBlank()) {
            Path file = Path.of(seedsFile.trim());
            if (!Files.exists(file)) {
                throw new IllegalArgumentException("seeds file not found: " + file);
            }
            try {
                for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                    String trimmed = line.trim();
                    if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                        continue;
                    }
                    for (String token : trimmed.split(",")) {
                        addSeed(unique, token);
                    }
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to read seeds file: " + file, e);
            }
        }
        return List.copyOf(unique);
    }

    private static void addSeed(Set<String> unique, String raw) {
        if (raw == null) {
            return;
        }
        String seed = raw.trim();
        if (seed.startsWith("\uFEFF")) {
            seed = seed.substring(1);
        }
        if (!seed.isEmpty()) {
            unique.add(seed);
        }
    }
}
