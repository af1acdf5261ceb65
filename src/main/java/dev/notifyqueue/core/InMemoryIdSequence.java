package dev.notifyqueue.core;

/**
 * Plain id sequence for the single control thread. The first id handed out is 1.
 */
final class InMemoryIdSequence implements IdSequence {
    private long last;

    @Override
    public long current() {
        return last;
    }

    @Override
    public long next() {
        if (last == Long.MAX_VALUE) {
            throw new IllegalStateException("Notification id sequence exhausted (Long.MAX_VALUE)");
        }
        return ++last;
    }

    @Override
    public boolean skipPast(long id) {
        if (id <= 0) {
            throw new IllegalArgumentException("notification ids must be positive, got " + id);
        }
        if (id <= last) {
            return false;
        }
        last = id;
        return true;
    }
}
