package dev.notifyqueue.core;

import dev.notifyqueue.api.NotificationQueues;
import dev.notifyqueue.api.QueueSnapshot;
import dev.notifyqueue.config.QueueConfig;
import dev.notifyqueue.model.CloseReason;
import dev.notifyqueue.model.FullscreenBehavior;
import dev.notifyqueue.model.Notification;
import dev.notifyqueue.queue.NotificationQueue;
import dev.notifyqueue.ser.JsonSnapshotSerializer;
import dev.notifyqueue.ser.SnapshotSerializer;
import dev.notifyqueue.signal.CloseSignalSink;
import dev.notifyqueue.signal.LoggingCloseSignalSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory queue engine of a notification daemon: owns waiting, displayed and history, assigns ids, stacks
 * duplicates, expires displayed notifications and gates promotion behind a pause switch.
 *
 * <p>Each instance is a self-contained context. Constructing it is the {@code init} step and {@link #close()} is
 * the {@code teardown} step; instances share no state, so several may coexist (for example one per test).
 *
 * <p><strong>Threading:</strong> not thread-safe. All calls are expected from the daemon's single control
 * thread, in whatever order arrivals, timer ticks and dismissals occur. Every call leaves the three queues
 * mutually consistent.
 *
 * <p><strong>Display sync:</strong> the engine never renders. After {@link #insert}, any close,
 * {@link #checkTimeouts} or {@link #update}, the caller must resynchronize the display.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * QueueConfig config = new QueueConfig().setDisplayedLimit(3);
 * try (NotificationQueueEngine queues = new NotificationQueueEngine(config, bus::emitClosed)) {
 *     long id = queues.insert(Notification.builder().appName("mail").summary("New message").build());
 *     queues.update(false);                 // id is now displayed
 *     queues.checkTimeouts(false, false);   // on each timer tick
 *     long wakeIn = queues.getNextDataChange(clock.millis());
 * }
 * }</pre>
 */
public class NotificationQueueEngine implements NotificationQueues {
    private static final Logger logger = LoggerFactory.getLogger(NotificationQueueEngine.class);

    static final String MDC_KEY = "notificationQueue";

    private final String name;
    private final QueueConfig config;
    private final Clock clock;
    private final CloseSignalSink closeSink;
    private final NotificationRegistry registry;
    private final QueueStore store;
    private final DuplicateMatcher matcher = new DuplicateMatcher();
    private final TimeoutEvaluator timeouts;
    private final PauseController pause = new PauseController();
    private final SnapshotSerializer snapshotSerializer = new JsonSnapshotSerializer();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates queues that only log close signals, on the system UTC clock.
     */
    public NotificationQueueEngine(QueueConfig config) {
        this(config, new LoggingCloseSignalSink(), null);
    }

    public NotificationQueueEngine(QueueConfig config, CloseSignalSink closeSink) {
        this(config, closeSink, null);
    }

    /**
     * Creates queues with the specified clock.
     *
     * @param config    policy constants: limits, timeouts, history behavior
     * @param closeSink receiver of close signals
     * @param clock     the clock to use for time operations, null for system UTC
     * @throws IllegalArgumentException if the configured limits are negative
     */
    public NotificationQueueEngine(QueueConfig config, CloseSignalSink closeSink, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.closeSink = Objects.requireNonNull(closeSink, "closeSink cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.name = Objects.requireNonNullElse(config.getName(), "default");

        MDC.put(MDC_KEY, name);
        try {
            this.store = new QueueStore(config.getDisplayedLimit(), config.getHistoryLength());
            this.registry = new NotificationRegistry(new InMemoryIdSequence());
            this.timeouts = new TimeoutEvaluator(config);
            logger.info("Initialized notification queues '{}' (displayedLimit={}, historyLength={}, stackDuplicates={})",
                    name, config.getDisplayedLimit(), config.getHistoryLength(), config.isStackDuplicates());
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    @Override
    public void setDisplayedLimit(int limit) {
        requireOpen();
        store.setDisplayedLimit(limit);
        logger.info("Displayed limit for '{}' set to {}", name, limit);
    }

    @Override
    public List<QueuedNotification> getDisplayed() {
        requireOpen();
        return store.displayed().snapshot();
    }

    @Override
    public List<QueuedNotification> getWaiting() {
        requireOpen();
        return store.waiting().snapshot();
    }

    @Override
    public List<QueuedNotification> getHistory() {
        requireOpen();
        return store.history().snapshot();
    }

    @Override
    public int lengthWaiting() {
        requireOpen();
        return store.waiting().size();
    }

    @Override
    public int lengthDisplayed() {
        requireOpen();
        return store.displayed().size();
    }

    @Override
    public int lengthHistory() {
        requireOpen();
        return store.history().size();
    }

    @Override
    public long insert(Notification notification) {
        requireOpen();
        Objects.requireNonNull(notification, "notification cannot be null");
        long now = clock.millis();

        // Explicit id: replace or adopt, never deduplicate
        if (notification.replacesId() != 0) {
            long id = notification.replacesId();
            QueuedNotification existing = registry.lookup(id);
            if (existing != null) {
                replaceContent(existing, notification, now);
                return id;
            }
            registry.observeExplicitId(id);
            QueuedNotification adopted = new QueuedNotification(id, notification, now);
            registry.register(adopted);
            store.appendWaiting(adopted);
            logger.debug("Requested id {} not live, inserted as new waiting notification", id);
            return id;
        }

        QueuedNotification tagged = matcher.findByStackTag(notification, store.waiting(), store.displayed());
        if (tagged != null) {
            return replaceByStackTag(tagged, notification, now);
        }

        if (config.isStackDuplicates()) {
            QueuedNotification duplicate = matcher.findDuplicate(notification, store.waiting(), store.displayed());
            if (duplicate != null) {
                matcher.merge(duplicate, notification, now);
                return 0;
            }
        }

        QueuedNotification entry = new QueuedNotification(registry.nextId(), notification, now);
        registry.register(entry);
        store.appendWaiting(entry);
        if (logger.isDebugEnabled()) {
            logger.debug("Inserted notification {} from '{}' into waiting ({} waiting)",
                    entry.getId(), notification.appName(), store.waiting().size());
        }
        return entry.getId();
    }

    @Override
    public boolean replaceById(Notification notification) {
        requireOpen();
        Objects.requireNonNull(notification, "notification cannot be null");
        long id = notification.replacesId();
        if (id == 0) {
            throw new IllegalArgumentException("replaceById requires a non-zero replacesId");
        }
        QueuedNotification existing = registry.lookup(id);
        if (existing == null) {
            logger.debug("Replace of notification {} ignored, not waiting or displayed", id);
            return false;
        }
        replaceContent(existing, notification, clock.millis());
        return true;
    }

    @Override
    public void closeById(long id, CloseReason reason) {
        requireOpen();
        Objects.requireNonNull(reason, "reason cannot be null");
        QueuedNotification entry = registry.lookup(id);
        if (entry == null) {
            logger.debug("Close of notification {} ignored, not waiting or displayed", id);
            return;
        }
        closeLive(entry, reason);
    }

    @Override
    public void closeNotification(QueuedNotification notification, CloseReason reason) {
        requireOpen();
        Objects.requireNonNull(notification, "notification cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
        if (!closeIfLive(notification, reason)) {
            logger.debug("Close of notification {} ignored, no longer waiting or displayed", notification.getId());
        }
    }

    @Override
    public void historyPop() {
        requireOpen();
        QueuedNotification entry = store.popHistory();
        if (entry == null) {
            logger.trace("History pop on empty history");
            return;
        }
        entry.setCloseReason(null);
        entry.setRedisplayed(true);
        if (config.isStickyHistory()) {
            entry.setContent(entry.getContent().toBuilder().timeoutMillis(0).build());
            entry.setSticky(true);
        }
        if (registry.isLive(entry.getId())) {
            long freshId = registry.nextId();
            logger.warn("Id {} from history is live again, restoring notification as {}", entry.getId(), freshId);
            entry.setId(freshId);
        }
        registry.register(entry);
        store.appendWaiting(entry);
        logger.debug("Restored notification {} from history to waiting", entry.getId());
    }

    @Override
    public void historyPush(QueuedNotification notification) {
        requireOpen();
        Objects.requireNonNull(notification, "notification cannot be null");
        if (notification.getLocation() != QueueLocation.DETACHED) {
            throw new IllegalStateException("Notification " + notification.getId()
                    + " must be removed from its queue before pushing to history, but is " + notification.getLocation());
        }
        archive(notification);
    }

    @Override
    public void historyPushAll() {
        requireOpen();
        int count = store.waiting().size() + store.displayed().size();
        for (QueuedNotification entry : store.waiting().snapshot()) {
            closeIfLive(entry, CloseReason.DISMISSED_BY_USER);
        }
        for (QueuedNotification entry : store.displayed().snapshot()) {
            closeIfLive(entry, CloseReason.DISMISSED_BY_USER);
        }
        logger.debug("Closed all {} waiting and displayed notifications into history", count);
    }

    @Override
    public void checkTimeouts(boolean idle, boolean fullscreen) {
        requireOpen();
        if (store.displayed().isEmpty()) {
            return;
        }
        long now = clock.millis();
        for (QueuedNotification entry : store.displayed().snapshot()) {
            // a close signal handler may already have closed or moved it
            if (!isLive(entry) || !entry.isDisplayed()) {
                continue;
            }
            if (timeouts.isHeld(entry, idle, fullscreen)) {
                entry.setDisplayedAtMillis(now);
                continue;
            }
            if (timeouts.isExpired(entry, now)) {
                if (logger.isDebugEnabled()) {
                    logger.debug("Notification {} expired after {} ms on screen",
                            entry.getId(), now - entry.getDisplayedAtMillis());
                }
                closeLive(entry, CloseReason.EXPIRED);
            }
        }
    }

    @Override
    public void update(boolean fullscreen) {
        requireOpen();
        if (pause.isPaused()) {
            logger.trace("Update skipped, display paused");
            return;
        }
        long now = clock.millis();

        if (fullscreen) {
            List<QueuedNotification> pushBack = new ArrayList<>();
            for (QueuedNotification entry : store.displayed()) {
                if (entry.getContent().fullscreen() == FullscreenBehavior.PUSHBACK) {
                    pushBack.add(entry);
                }
            }
            if (!pushBack.isEmpty()) {
                store.pushBack(pushBack);
                logger.debug("Pushed {} notifications back to waiting for fullscreen", pushBack.size());
            }
        }

        for (QueuedNotification entry : store.waiting().snapshot()) {
            if (!store.hasDisplaySlot()) {
                break;
            }
            // Policy hook: only SHOW notifications are promoted over a fullscreen window
            if (fullscreen && entry.getContent().fullscreen() != FullscreenBehavior.SHOW) {
                continue;
            }
            store.promote(entry, now);
            logger.debug("Displaying notification {}", entry.getId());
        }
    }

    @Override
    public long getNextDataChange(long now) {
        requireOpen();
        long sleep = Long.MAX_VALUE;
        for (QueuedNotification entry : store.displayed()) {
            long next = timeouts.nextChange(entry, now);
            if (next == 0) {
                return 0;
            }
            sleep = Math.min(sleep, next);
        }
        return sleep == Long.MAX_VALUE ? NO_DATA_CHANGE : sleep;
    }

    @Override
    public void pauseOn() {
        requireOpen();
        pause.pause();
    }

    @Override
    public void pauseOff() {
        requireOpen();
        pause.resume();
    }

    @Override
    public boolean isPaused() {
        requireOpen();
        return pause.isPaused();
    }

    @Override
    public QueueSnapshot snapshot() {
        requireOpen();
        return new QueueSnapshot(
                pause.isPaused(),
                store.displayedLimit(),
                toEntries(store.waiting()),
                toEntries(store.displayed()),
                toEntries(store.history()));
    }

    @Override
    public byte[] exportSnapshot() {
        return snapshotSerializer.serialize(snapshot());
    }

    /**
     * Releases every notification in every queue. Operations afterwards throw {@link IllegalStateException}.
     * This method is idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed notification queues '{}'", name);
            return;
        }
        MDC.put(MDC_KEY, name);
        try {
            logger.info("Tearing down notification queues '{}' (waiting={}, displayed={}, history={})",
                    name, store.waiting().size(), store.displayed().size(), store.history().size());
            store.clear();
            registry.clear();
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String getName() {
        return name;
    }

    private void requireOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Notification queues are closed: " + name);
        }
    }

    private void replaceContent(QueuedNotification existing, Notification replacement, long now) {
        existing.setContent(replacement);
        existing.setSticky(false);
        existing.setCreatedAtMillis(now);
        if (existing.isDisplayed()) {
            existing.setDisplayedAtMillis(now);
        }
        logger.debug("Replaced notification {} in place ({})", existing.getId(), existing.getLocation());
    }

    private long replaceByStackTag(QueuedNotification tagged, Notification notification, long now) {
        QueuedNotification fresh = new QueuedNotification(registry.nextId(), notification, now);
        fresh.setRepeatCount(tagged.getRepeatCount());
        store.replaceLive(tagged, fresh, now);
        registry.retire(tagged);
        registry.register(fresh);
        logger.debug("Notification {} replaces {} by stack tag '{}'", fresh.getId(), tagged.getId(), notification.stackTag());
        finishClose(tagged, CloseReason.REPLACED);
        return fresh.getId();
    }

    private boolean isLive(QueuedNotification entry) {
        return registry.lookup(entry.getId()) == entry;
    }

    private boolean closeIfLive(QueuedNotification entry, CloseReason reason) {
        if (!isLive(entry)) {
            return false;
        }
        closeLive(entry, reason);
        return true;
    }

    private void closeLive(QueuedNotification entry, CloseReason reason) {
        if (!store.removeLive(entry)) {
            throw new IllegalStateException("registered notification missing from its queue: " + entry);
        }
        registry.retire(entry);
        finishClose(entry, reason);
    }

    private void finishClose(QueuedNotification entry, CloseReason reason) {
        entry.setCloseReason(reason);
        logger.debug("Closed notification {} ({})", entry.getId(), reason);

        // the transport already saw a close for notifications restored from history
        if (!entry.isRedisplayed()) {
            signalClosed(entry.getId(), reason);
        }

        if (config.isHistoryEligible(reason)) {
            archive(entry);
        } else {
            logger.debug("Notification {} discarded, {} is not archived", entry.getId(), reason);
        }
    }

    private void archive(QueuedNotification entry) {
        if (entry.getContent().historyIgnore()) {
            logger.debug("Notification {} discarded, marked history-ignore", entry.getId());
            return;
        }
        store.pushHistory(entry);
    }

    private void signalClosed(long id, CloseReason reason) {
        try {
            closeSink.notificationClosed(id, reason);
        } catch (RuntimeException e) {
            logger.warn("Failed to signal close of notification {} ({}): {}", id, reason, e.getMessage(), e);
        }
    }

    private static List<QueueSnapshot.Entry> toEntries(NotificationQueue queue) {
        List<QueueSnapshot.Entry> entries = new ArrayList<>(queue.size());
        for (QueuedNotification e : queue) {
            Notification n = e.getContent();
            entries.add(new QueueSnapshot.Entry(
                    e.getId(), n.appName(), n.summary(), n.body(), n.urgency(), n.progress(),
                    e.getRepeatCount(), e.getCreatedAtMillis(), e.getDisplayedAtMillis(), e.getCloseReason()));
        }
        return entries;
    }
}
