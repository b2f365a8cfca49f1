package io.survivalmesh.chunk;

import io.survivalmesh.codec.PayloadCodec;
import io.survivalmesh.config.SurvivalMeshConfig;
import io.survivalmesh.util.Ids;
import io.survivalmesh.util.Jsons;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a message into chunks whose serialized JSON form fits a radio unit, and puts them back
 * together.
 *
 * <p>Slices are cut on code point boundaries by escaped UTF-8 byte budget, so a chunk never
 * exceeds the unit even for multi-byte or escape-heavy text. The same input always yields the
 * same slice boundaries; only the {@code messageId} changes between calls.
 */
public final class MessageChunker {
    private static final int MIN_DATA_BYTES = 6;

    private MessageChunker() {
    }

    public static List<MessageChunk> split(String message, int maxUnitBytes) {
        return split(message, maxUnitBytes, SurvivalMeshConfig.DEFAULT_CHUNK_OVERHEAD_BYTES);
    }

    public static List<MessageChunk> split(String message, int maxUnitBytes, int overheadBytes) {
        if (message == null || message.isEmpty()) {
            throw new ChunkingException(ChunkingException.Reason.EMPTY_MESSAGE, "Cannot split empty message into chunks");
        }
        int dataBudget = maxUnitBytes - Math.max(0, overheadBytes);
        if (dataBudget < MIN_DATA_BYTES) {
            throw new ChunkingException(
                    ChunkingException.Reason.UNIT_TOO_SMALL,
                    "maxUnitBytes=" + maxUnitBytes + " cannot hold " + overheadBytes + " bytes of chunk framing"
            );
        }

        List<String> slices = slice(message, dataBudget);
        String messageId = Ids.newChunkMessageId();
        String checksum = PayloadCodec.checksum(message);
        int total = slices.size();
        List<MessageChunk> chunks = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            chunks.add(new MessageChunk(messageId, i, total, slices.get(i), checksum));
        }

        for (MessageChunk chunk : chunks) {
            int serialized = PayloadCodec.size(Jsons.toCompactJson(chunk));
            if (serialized > maxUnitBytes) {
                throw new ChunkingException(
                        ChunkingException.Reason.CHUNK_TOO_LARGE,
                        "Chunk " + chunk.chunkIndex() + " serializes to " + serialized + " bytes, max=" + maxUnitBytes
                );
            }
        }
        return chunks;
    }

    /**
     * Rebuilds the original message. Chunks may arrive in any order and may repeat an index;
     * the first chunk seen for an index wins.
     */
    public static String reassemble(Collection<MessageChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            throw new ChunkingException(ChunkingException.Reason.INCOMPLETE_CHUNKS, "Cannot reassemble empty chunk set");
        }
        MessageChunk first = chunks.iterator().next();
        String messageId = first.messageId();
        int totalChunks = first.totalChunks();
        String checksum = first.checksum();
        Map<Integer, MessageChunk> byIndex = new TreeMap<>();
        for (MessageChunk chunk : chunks) {
            if (!safeEquals(messageId, chunk.messageId())) {
                throw new ChunkingException(
                        ChunkingException.Reason.MESSAGE_ID_MISMATCH,
                        "Chunk messageId mismatch: expected " + messageId + ", got " + chunk.messageId()
                );
            }
            if (chunk.totalChunks() != totalChunks) {
                throw new ChunkingException(
                        ChunkingException.Reason.TOTAL_CHUNKS_MISMATCH,
                        "Chunk totalChunks mismatch: expected " + totalChunks + ", got " + chunk.totalChunks()
                );
            }
            if (!safeEquals(checksum, chunk.checksum())) {
                throw new ChunkingException(
                        ChunkingException.Reason.CHECKSUM_MISMATCH,
                        "Chunks of " + messageId + " disagree on checksum"
                );
            }
            byIndex.putIfAbsent(chunk.chunkIndex(), chunk);
        }
        if (byIndex.size() < totalChunks) {
            throw new ChunkingException(
                    ChunkingException.Reason.INCOMPLETE_CHUNKS,
                    "Incomplete chunks: expected " + totalChunks + ", got " + byIndex.size()
            );
        }

        List<MessageChunk> ordered = new ArrayList<>(byIndex.values());
        ordered.sort(Comparator.comparingInt(MessageChunk::chunkIndex));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ordered.size(); i++) {
            MessageChunk chunk = ordered.get(i);
            if (chunk.chunkIndex() != i || i >= totalChunks) {
                throw new ChunkingException(
                        ChunkingException.Reason.MISSING_OR_DUPLICATE_INDEX,
                        "Missing or duplicate chunk: expected index " + i + ", got " + chunk.chunkIndex()
                );
            }
            sb.append(chunk.data() == null ? "" : chunk.data());
        }

        String reassembled = sb.toString();
        if (checksum != null && !checksum.isBlank()) {
            String calculated = PayloadCodec.checksum(reassembled);
            if (!calculated.equals(checksum)) {
                throw new ChunkingException(
                        ChunkingException.Reason.CHECKSUM_MISMATCH,
                        "Checksum mismatch: expected " + checksum + ", got " + calculated
                );
            }
        }
        return reassembled;
    }

    private static List<String> slice(String message, int dataBudget) {
        List<String> slices = new ArrayList<>();
        int start = 0;
        int used = 0;
        int i = 0;
        while (i < message.length()) {
            int cp = message.codePointAt(i);
            int width = Character.charCount(cp);
            int cost = escapedBytes(cp);
            if (used + cost > dataBudget) {
                slices.add(message.substring(start, i));
                start = i;
                used = 0;
            }
            used += cost;
            i += width;
        }
        slices.add(message.substring(start));
        return slices;
    }

    /**
     * Bytes one code point occupies inside a compact JSON string: Jackson escapes quote,
     * backslash and control characters; everything else is raw UTF-8.
     */
    static int escapedBytes(int codePoint) {
        if (codePoint == '"' || codePoint == '\\') {
            return 2;
        }
        if (codePoint < 0x20) {
            return switch (codePoint) {
                case '\b', '\t', '\n', '\f', '\r' -> 2;
                default -> 6;
            };
        }
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    private static boolean safeEquals(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
