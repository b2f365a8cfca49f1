package io.survivalmesh.chunk;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Collects chunks per {@code messageId} until a message is complete.
 *
 * <p>Partial groups older than the timeout (measured from their first chunk) are evicted by a
 * periodic sweep, so a sender that never finishes a transfer cannot grow memory without bound.
 * The eviction listener runs on the sweep thread and must not throw; an exception there ends the
 * schedule.
 */
public final class ChunkReassembler implements AutoCloseable {
    private final long timeoutMs;
    private final long sweepIntervalMs;
    private final LongSupplier clock;
    private final Consumer<List<String>> evictionListener;
    private final Map<String, PartialMessage> partialMessages;
    private ScheduledExecutorService sweeper;
    private ScheduledFuture<?> sweepTask;

    public ChunkReassembler(long timeoutMs, long sweepIntervalMs) {
        this(timeoutMs, sweepIntervalMs, System::currentTimeMillis, evicted -> {
        });
    }

    public ChunkReassembler(
            long timeoutMs,
            long sweepIntervalMs,
            LongSupplier clock,
            Consumer<List<String>> evictionListener
    ) {
        this.timeoutMs = Math.max(1L, timeoutMs);
        this.sweepIntervalMs = Math.max(1L, sweepIntervalMs);
        this.clock = clock;
        this.evictionListener = evictionListener;
        this.partialMessages = new LinkedHashMap<>();
    }

    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chunk-reassembly-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepTask = sweeper.scheduleWithFixedDelay(
                this::sweepExpired,
                sweepIntervalMs,
                sweepIntervalMs,
                TimeUnit.MILLISECONDS
        );
    }

    /**
     * Returns the reassembled message once every distinct index has arrived, otherwise null.
     * Repeated indices are absorbed. A chunk whose index falls outside the group is rejected and
     * leaves the group untouched. A completed group that fails verification is discarded and the
     * failure is rethrown.
     */
    public synchronized String addChunk(MessageChunk chunk) {
        String messageId = chunk.messageId();
        PartialMessage entry = partialMessages.get(messageId);
        int expectedTotal = entry == null ? chunk.totalChunks() : entry.totalChunks;
        if (chunk.chunkIndex() < 0 || chunk.chunkIndex() >= expectedTotal) {
            // Out-of-range frames never join a group.
            throw new ChunkingException(
                    ChunkingException.Reason.MISSING_OR_DUPLICATE_INDEX,
                    "Chunk index " + chunk.chunkIndex() + " out of range 0.." + (expectedTotal - 1) + " for " + messageId
            );
        }
        if (entry == null) {
            entry = new PartialMessage(chunk.totalChunks(), clock.getAsLong());
            partialMessages.put(messageId, entry);
        }
        if (chunk.totalChunks() != entry.totalChunks) {
            partialMessages.remove(messageId);
            throw new ChunkingException(
                    ChunkingException.Reason.TOTAL_CHUNKS_MISMATCH,
                    "Chunk totalChunks mismatch for " + messageId + ": expected "
                            + entry.totalChunks + ", got " + chunk.totalChunks()
            );
        }
        entry.chunks.putIfAbsent(chunk.chunkIndex(), chunk);
        if (entry.chunks.size() < entry.totalChunks) {
            return null;
        }
        partialMessages.remove(messageId);
        return MessageChunker.reassemble(entry.chunks.values());
    }

    /**
     * Evicts groups whose first chunk is older than the timeout and returns their ids.
     */
    public List<String> sweepExpired() {
        List<String> evicted = new ArrayList<>();
        synchronized (this) {
            long now = clock.getAsLong();
            Iterator<Map.Entry<String, PartialMessage>> it = partialMessages.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, PartialMessage> e = it.next();
                if (now - e.getValue().firstSeenMs > timeoutMs) {
                    evicted.add(e.getKey());
                    it.remove();
                }
            }
        }
        if (!evicted.isEmpty()) {
            evictionListener.accept(List.copyOf(evicted));
        }
        return evicted;
    }

    public synchronized int partialMessageCount() {
        return partialMessages.size();
    }

    @Override
    public synchronized void close() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        partialMessages.clear();
    }

    private static final class PartialMessage {
        private final int totalChunks;
        private final long firstSeenMs;
        private final Map<Integer, MessageChunk> chunks;

        private PartialMessage(int totalChunks, long firstSeenMs) {
            this.totalChunks = totalChunks;
            this.firstSeenMs = firstSeenMs;
            this.chunks = new LinkedHashMap<>();
        }
    }
}
