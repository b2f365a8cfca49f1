package io.survivalmesh.model;

/**
 * Send-queue urgency. Lower rank is sent first.
 */
public enum Priority {
    SOS(0),
    WANT(1),
    HAVE(2),
    ACK(3);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static Priority forKind(PostKind kind) {
        if (kind == null) {
            return HAVE;
        }
        return switch (kind) {
            case SOS -> SOS;
            case WANT -> WANT;
            case HAVE -> HAVE;
        };
    }
}
