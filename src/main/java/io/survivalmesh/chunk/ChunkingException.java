package io.survivalmesh.chunk;

public final class ChunkingException extends RuntimeException {
    private final Reason reason;

    public ChunkingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        EMPTY_MESSAGE,
        UNIT_TOO_SMALL,
        CHUNK_TOO_LARGE,
        MESSAGE_ID_MISMATCH,
        TOTAL_CHUNKS_MISMATCH,
        INCOMPLETE_CHUNKS,
        MISSING_OR_DUPLICATE_INDEX,
        CHECKSUM_MISMATCH;

        /**
         * Integrity failures come from the network; the rest are contract violations by the caller.
         */
        public boolean integrity() {
            return this == CHECKSUM_MISMATCH
                    || this == INCOMPLETE_CHUNKS
                    || this == MISSING_OR_DUPLICATE_INDEX
                    || this == TOTAL_CHUNKS_MISMATCH
                    || this == MESSAGE_ID_MISMATCH;
        }
    }
}
