package io.survivalmesh.codec;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Size measurement, zlib compression and integrity checksum for radio payloads.
 *
 * <p>Compressed blobs are base64 so they can travel inside a JSON string field.
 */
public final class PayloadCodec {
    private static final int BUFFER_BYTES = 512;

    private PayloadCodec() {
    }

    /**
     * Exact UTF-8 byte length. Unpaired surrogates count as U+FFFD (3 bytes).
     */
    public static int size(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int bytes = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char ch = text.charAt(i);
            if (ch < 0x80) {
                bytes += 1;
            } else if (ch < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(ch)
                    && i + 1 < length
                    && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }

    public static String compress(String text) {
        byte[] input = (text == null ? "" : text).getBytes(StandardCharsets.UTF_8);
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(16, input.length / 2));
            byte[] buf = new byte[BUFFER_BYTES];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            return Base64.getEncoder().encodeToString(out.toByteArray());
        } finally {
            deflater.end();
        }
    }

    public static String decompress(String encoded) {
        if (encoded == null) {
            throw new CorruptPayloadException("Compressed payload is null");
        }
        byte[] compressed;
        try {
            compressed = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new CorruptPayloadException("Compressed payload is not valid base64", e);
        }
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(16, compressed.length * 3));
            byte[] buf = new byte[BUFFER_BYTES];
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new CorruptPayloadException("Compressed payload is truncated");
                }
                out.write(buf, 0, n);
            }
            if (inflater.getRemaining() > 0) {
                throw new CorruptPayloadException("Trailing bytes after compressed stream");
            }
            return decodeUtf8(out.toByteArray());
        } catch (DataFormatException e) {
            throw new CorruptPayloadException("Compressed payload is corrupted", e);
        } finally {
            inflater.end();
        }
    }

    /**
     * 32-bit polynomial string hash (h * 31 + c over UTF-16 units), absolute value in base36.
     * Not a security primitive.
     */
    public static String checksum(String text) {
        int hash = text == null ? 0 : text.hashCode();
        return Long.toString(Math.abs((long) hash), 36);
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CorruptPayloadException("Decompressed payload is not valid UTF-8", e);
        }
    }
}
