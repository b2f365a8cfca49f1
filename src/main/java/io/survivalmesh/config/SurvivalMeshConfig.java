package io.survivalmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public final class SurvivalMeshConfig {
    public static final String SETTINGS_FILE_NAME = "survivalmesh-settings.json";
    public static final String EVENT_LOG_FILE_NAME = "events.log";
    public static final int DEFAULT_MAX_HOPS = 5;
    public static final List<Long> DEFAULT_RETRY_BACKOFF_MS = List.of(1_000L, 2_000L, 4_000L, 8_000L);
    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 512;
    public static final long DEFAULT_REASSEMBLY_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_REASSEMBLY_SWEEP_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_INTER_SEND_DELAY_MS = 100L;
    public static final int DEFAULT_CHUNK_OVERHEAD_BYTES = 150;
    public static final int DEFAULT_SEEN_MESSAGE_LIMIT = 1_000;
    public static final int DEFAULT_POST_ID_MIN_LENGTH = 7;
    public static final int DEFAULT_POST_ID_MAX_LENGTH = 8;
    public static final int DEFAULT_MAX_DESCRIPTION_BYTES = 100;
    public static final int DEFAULT_ERROR_LOG_CAPACITY = 100;
    public static final int MAX_SERIALIZED_POST_BYTES = 512;
    public static final String DEFAULT_DISPLAY_NAME = "SurvivalMesh";

    private final Path rootDir;

    public SurvivalMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static SurvivalMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new SurvivalMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path eventLogFile() {
        return rootDir.resolve("log").resolve(EVENT_LOG_FILE_NAME);
    }
}
