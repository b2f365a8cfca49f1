package io.survivalmesh.chunk;

import io.survivalmesh.codec.PayloadCodec;
import io.survivalmesh.util.Jsons;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageChunkerTest {

    @Test
    void oversizedMessageSplitsAndReassemblesInAnyOrder() {
        String message = "a".repeat(1000);
        List<MessageChunk> chunks = MessageChunker.split(message, 512);
        assertTrue(chunks.size() > 1);

        List<MessageChunk> shuffled = new ArrayList<>(chunks);
        Collections.shuffle(shuffled, new Random(7L));
        assertEquals(message, MessageChunker.reassemble(shuffled));
    }

    @Test
    void everyChunkFitsTheUnit() {
        String message = "Need insulin at house 12, \"urgent\"\n".repeat(40) + "日本語🚑".repeat(30);
        for (int unit : new int[]{160, 200, 512}) {
            List<MessageChunk> chunks = MessageChunker.split(message, unit, 150);
            for (MessageChunk chunk : chunks) {
                int size = PayloadCodec.size(Jsons.toCompactJson(chunk));
                assertTrue(size <= unit, "chunk " + chunk.chunkIndex() + " is " + size + " bytes, unit " + unit);
            }
            assertEquals(message, MessageChunker.reassemble(chunks));
        }
    }

    @Test
    void chunksShareIdChecksumAndTotal() {
        String message = "b".repeat(900);
        List<MessageChunk> chunks = MessageChunker.split(message, 300, 150);
        for (int i = 0; i < chunks.size(); i++) {
            MessageChunk chunk = chunks.get(i);
            assertEquals(chunks.get(0).messageId(), chunk.messageId());
            assertEquals(PayloadCodec.checksum(message), chunk.checksum());
            assertEquals(chunks.size(), chunk.totalChunks());
            assertEquals(i, chunk.chunkIndex());
        }
    }

    @Test
    void splitIsDeterministicApartFromMessageId() {
        String message = "Spare blankets and a generator ".repeat(30);
        List<MessageChunk> first = MessageChunker.split(message, 256);
        List<MessageChunk> second = MessageChunker.split(message, 256);
        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).data(), second.get(i).data());
        }
    }

    @Test
    void smallMessageIsOneChunk() {
        List<MessageChunk> chunks = MessageChunker.split("hello", 512);
        assertEquals(1, chunks.size());
        assertEquals("hello", chunks.get(0).data());
    }

    @Test
    void duplicatedChunksAreTolerated() {
        String message = "c".repeat(1000);
        List<MessageChunk> chunks = new ArrayList<>(MessageChunker.split(message, 512));
        chunks.add(chunks.get(0));
        chunks.add(chunks.get(chunks.size() - 2));
        Collections.shuffle(chunks, new Random(3L));
        assertEquals(message, MessageChunker.reassemble(chunks));
    }

    @Test
    void missingChunkIsIncomplete() {
        List<MessageChunk> chunks = new ArrayList<>(MessageChunker.split("d".repeat(1000), 512));
        chunks.remove(1);
        ChunkingException e = assertThrows(ChunkingException.class, () -> MessageChunker.reassemble(chunks));
        assertEquals(ChunkingException.Reason.INCOMPLETE_CHUNKS, e.reason());
    }

    @Test
    void tamperedChecksumIsAnIntegrityFailure() {
        List<MessageChunk> tampered = new ArrayList<>();
        for (MessageChunk chunk : MessageChunker.split("e".repeat(1000), 512)) {
            tampered.add(new MessageChunk(chunk.messageId(), chunk.chunkIndex(), chunk.totalChunks(), chunk.data(), "zzzz"));
        }
        ChunkingException e = assertThrows(ChunkingException.class, () -> MessageChunker.reassemble(tampered));
        assertEquals(ChunkingException.Reason.CHECKSUM_MISMATCH, e.reason());
        assertTrue(e.reason().integrity());
    }

    @Test
    void tamperedDataIsAnIntegrityFailure() {
        List<MessageChunk> chunks = new ArrayList<>(MessageChunker.split("f".repeat(1000), 512));
        MessageChunk first = chunks.get(0);
        chunks.set(0, new MessageChunk(first.messageId(), 0, first.totalChunks(), "g" + first.data().substring(1), first.checksum()));
        ChunkingException e = assertThrows(ChunkingException.class, () -> MessageChunker.reassemble(chunks));
        assertEquals(ChunkingException.Reason.CHECKSUM_MISMATCH, e.reason());
    }

    @Test
    void disagreeingMetadataIsRejected() {
        MessageChunk a = new MessageChunk("m1", 0, 2, "ab", "x");
        MessageChunk otherId = new MessageChunk("m2", 1, 2, "cd", "x");
        MessageChunk otherTotal = new MessageChunk("m1", 1, 3, "cd", "x");
        assertEquals(ChunkingException.Reason.MESSAGE_ID_MISMATCH,
                assertThrows(ChunkingException.class, () -> MessageChunker.reassemble(List.of(a, otherId))).reason());
        assertEquals(ChunkingException.Reason.TOTAL_CHUNKS_MISMATCH,
                assertThrows(ChunkingException.class, () -> MessageChunker.reassemble(List.of(a, otherTotal))).reason());
    }

    @Test
    void indexGapIsReported() {
        MessageChunk zero = new MessageChunk("m1", 0, 2, "ab", null);
        MessageChunk two = new MessageChunk("m1", 2, 2, "cd", null);
        ChunkingException e = assertThrows(ChunkingException.class, () -> MessageChunker.reassemble(List.of(zero, two)));
        assertEquals(ChunkingException.Reason.MISSING_OR_DUPLICATE_INDEX, e.reason());
    }

    @Test
    void contractViolationsFailFast() {
        assertEquals(ChunkingException.Reason.EMPTY_MESSAGE,
                assertThrows(ChunkingException.class, () -> MessageChunker.split("", 512)).reason());
        assertEquals(ChunkingException.Reason.UNIT_TOO_SMALL,
                assertThrows(ChunkingException.class, () -> MessageChunker.split("payload", 100)).reason());
        assertEquals(ChunkingException.Reason.INCOMPLETE_CHUNKS,
                assertThrows(ChunkingException.class, () -> MessageChunker.reassemble(List.of())).reason());
    }

    @Test
    void escapedBytesMatchJsonEncoding() {
        assertEquals(1, MessageChunker.escapedBytes('a'));
        assertEquals(2, MessageChunker.escapedBytes('"'));
        assertEquals(2, MessageChunker.escapedBytes('\n'));
        assertEquals(6, MessageChunker.escapedBytes(0x01));
        assertEquals(3, MessageChunker.escapedBytes('€'));
        assertEquals(4, MessageChunker.escapedBytes("😀".codePointAt(0)));
    }
}
