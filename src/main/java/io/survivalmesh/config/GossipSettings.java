package io.survivalmesh.config;

import io.survivalmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Effective tunables of one mesh node. Values read from a settings file are clamped to sane
 * lower bounds; absent fields fall back to the defaults.
 */
public record GossipSettings(
        int maxHops,
        List<Long> retryBackoffMs,
        int maxPayloadBytes,
        long reassemblyTimeoutMs,
        long reassemblySweepIntervalMs,
        long interSendDelayMs,
        int chunkOverheadBytes,
        int seenMessageLimit,
        int postIdMinLength,
        int postIdMaxLength,
        int maxDescriptionBytes,
        boolean syncOnDiscovery,
        int errorLogCapacity
) {
    public GossipSettings {
        retryBackoffMs = List.copyOf(retryBackoffMs);
    }

    public static GossipSettings defaults() {
        return new GossipSettings(
                SurvivalMeshConfig.DEFAULT_MAX_HOPS,
                SurvivalMeshConfig.DEFAULT_RETRY_BACKOFF_MS,
                SurvivalMeshConfig.DEFAULT_MAX_PAYLOAD_BYTES,
                SurvivalMeshConfig.DEFAULT_REASSEMBLY_TIMEOUT_MS,
                SurvivalMeshConfig.DEFAULT_REASSEMBLY_SWEEP_INTERVAL_MS,
                SurvivalMeshConfig.DEFAULT_INTER_SEND_DELAY_MS,
                SurvivalMeshConfig.DEFAULT_CHUNK_OVERHEAD_BYTES,
                SurvivalMeshConfig.DEFAULT_SEEN_MESSAGE_LIMIT,
                SurvivalMeshConfig.DEFAULT_POST_ID_MIN_LENGTH,
                SurvivalMeshConfig.DEFAULT_POST_ID_MAX_LENGTH,
                SurvivalMeshConfig.DEFAULT_MAX_DESCRIPTION_BYTES,
                true,
                SurvivalMeshConfig.DEFAULT_ERROR_LOG_CAPACITY
        );
    }

    /**
     * Reads {@code file} if it exists, defaults otherwise. A malformed file is a configuration
     * error and fails loudly.
     */
    public static GossipSettings load(Path file) {
        GossipSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    public static GossipSettings fromFile(SettingsFile file, GossipSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxHops = sanitizeInt(file.maxHops(), defaults.maxHops(), 1);
        List<Long> backoff = sanitizeBackoff(file.retryBackoffMs(), defaults.retryBackoffMs());
        int chunkOverhead = sanitizeInt(file.chunkOverheadBytes(), defaults.chunkOverheadBytes(), 64);
        int maxPayload = sanitizeInt(file.maxPayloadBytes(), defaults.maxPayloadBytes(), chunkOverhead + 16);
        long reassemblyTimeout = sanitizeLong(file.reassemblyTimeoutMs(), defaults.reassemblyTimeoutMs(), 100L);
        long sweepInterval = sanitizeLong(file.reassemblySweepIntervalMs(), defaults.reassemblySweepIntervalMs(), 10L);
        long interSendDelay = sanitizeLong(file.interSendDelayMs(), defaults.interSendDelayMs(), 0L);
        int seenLimit = sanitizeInt(file.seenMessageLimit(), defaults.seenMessageLimit(), 16);
        int idMin = sanitizeInt(file.postIdMinLength(), defaults.postIdMinLength(), 1);
        int idMax = sanitizeInt(file.postIdMaxLength(), defaults.postIdMaxLength(), idMin);
        if (idMax < idMin) {
            idMax = idMin;
        }
        int maxDescription = sanitizeInt(file.maxDescriptionBytes(), defaults.maxDescriptionBytes(), 1);
        boolean syncOnDiscovery = file.syncOnDiscovery() == null ? defaults.syncOnDiscovery() : file.syncOnDiscovery();
        int errorLogCapacity = sanitizeInt(file.errorLogCapacity(), defaults.errorLogCapacity(), 1);
        return new GossipSettings(
                maxHops,
                backoff,
                maxPayload,
                reassemblyTimeout,
                sweepInterval,
                interSendDelay,
                chunkOverhead,
                seenLimit,
                idMin,
                idMax,
                maxDescription,
                syncOnDiscovery,
                errorLogCapacity
        );
    }

    public int maxRetries() {
        return retryBackoffMs.size();
    }

    public GossipSettings withTiming(List<Long> backoffMs, long interSendMs) {
        return new GossipSettings(
                maxHops,
                backoffMs,
                maxPayloadBytes,
                reassemblyTimeoutMs,
                reassemblySweepIntervalMs,
                interSendMs,
                chunkOverheadBytes,
                seenMessageLimit,
                postIdMinLength,
                postIdMaxLength,
                maxDescriptionBytes,
                syncOnDiscovery,
                errorLogCapacity
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static List<Long> sanitizeBackoff(List<Long> raw, List<Long> fallback) {
        if (raw == null) {
            return fallback;
        }
        List<Long> out = new ArrayList<>(raw.size());
        for (Long value : raw) {
            if (value != null) {
                out.add(Math.max(0L, value));
            }
        }
        return out;
    }

    public record SettingsFile(
            Integer maxHops,
            List<Long> retryBackoffMs,
            Integer maxPayloadBytes,
            Long reassemblyTimeoutMs,
            Long reassemblySweepIntervalMs,
            Long interSendDelayMs,
            Integer chunkOverheadBytes,
            Integer seenMessageLimit,
            Integer postIdMinLength,
            Integer postIdMaxLength,
            Integer maxDescriptionBytes,
            Boolean syncOnDiscovery,
            Integer errorLogCapacity
    ) {
    }
}
