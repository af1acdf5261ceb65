package dev.notifyqueue.model;

/**
 * Why a notification left the waiting or displayed queue.
 *
 * <p>{@link #code()} is the value carried by the close signal on the wire.
 * {@link #REPLACED} and {@link #CLOSED_BY_RULE} have no dedicated protocol code and map to 4 (undefined).
 */
public enum CloseReason {
    EXPIRED(1),
    DISMISSED_BY_USER(2),
    CLOSED_BY_SIGNAL(3),
    REPLACED(4),
    CLOSED_BY_RULE(4);

    private final int code;

    CloseReason(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
