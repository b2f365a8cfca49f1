package io.survivalmesh.util;

import java.security.SecureRandom;

public final class Ids {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private Ids() {
    }

    /**
     * Freshness token shared by all chunks of one framed message:
     * base36 millis, a dash, then seven random base36 chars.
     */
    public static String newChunkMessageId() {
        return Long.toString(System.currentTimeMillis(), 36) + "-" + randomBase36(7);
    }

    /**
     * Eight-character post id: last four base36 chars of the clock plus four random chars.
     */
    public static String newPostId() {
        String clock = Long.toString(System.currentTimeMillis(), 36);
        String tail = clock.length() > 4 ? clock.substring(clock.length() - 4) : clock;
        return tail + randomBase36(8 - tail.length());
    }

    public static String newNodeId() {
        return "node-" + randomBase36(9);
    }

    public static String randomBase36(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(BASE36[RANDOM.nextInt(BASE36.length)]);
        }
        return sb.toString();
    }
}
