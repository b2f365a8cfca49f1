package io.survivalmesh.chunk;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One framed slice of a larger message. {@code checksum} covers the full reassembled message
 * and is identical across every chunk of the same {@code messageId}.
 */
@JsonPropertyOrder({"messageId", "chunkIndex", "totalChunks", "data", "checksum"})
public record MessageChunk(
        String messageId,
        int chunkIndex,
        int totalChunks,
        String data,
        String checksum
) {
}
