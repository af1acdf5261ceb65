package dev.notifyqueue.core;

/**
 * Source of notification ids: positive, strictly increasing, never {@code 0}.
 */
interface IdSequence {

    /**
     * Highest id handed out or observed so far, {@code 0} before the first one.
     */
    long current();

    long next();

    /**
     * Moves the sequence past an id chosen elsewhere, so {@link #next()} never returns it. Never moves backwards.
     *
     * @return true if the sequence moved
     * @throws IllegalArgumentException if {@code id} is not positive
     */
    boolean skipPast(long id);
}
