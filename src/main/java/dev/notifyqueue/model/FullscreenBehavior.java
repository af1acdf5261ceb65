package dev.notifyqueue.model;

/**
 * How a notification behaves while the desktop reports a fullscreen window.
 */
public enum FullscreenBehavior {
    /** Promoted and kept on screen as usual. */
    SHOW,
    /** Held in the waiting queue until fullscreen ends. */
    DELAY,
    /** Held like {@link #DELAY}, and moved back to waiting if it is already displayed. */
    PUSHBACK
}
