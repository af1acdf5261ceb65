package dev.notifyqueue.core;

import dev.notifyqueue.config.QueueConfig;
import dev.notifyqueue.model.CloseReason;
import dev.notifyqueue.model.FullscreenBehavior;
import dev.notifyqueue.testing.MutableClock;
import dev.notifyqueue.testing.RecordingCloseSignalSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.notifyqueue.testing.Notifications.builder;
import static dev.notifyqueue.testing.Notifications.simple;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Waiting to displayed promotion: displayed limit, pause gate and fullscreen behaviors.
 */
class NotificationQueueEngineUpdateTest {

    private MutableClock clock;
    private RecordingCloseSignalSink sink;
    private NotificationQueueEngine queues;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtMillis(10_000L);
        sink = new RecordingCloseSignalSink();
        queues = new NotificationQueueEngine(new QueueConfig(), sink, clock);
    }

    @AfterEach
    void tearDown() {
        queues.close();
    }

    private static List<Long> ids(List<QueuedNotification> entries) {
        return entries.stream().map(QueuedNotification::getId).toList();
    }

    private void insertMany(int count) {
        for (int i = 0; i < count; i++) {
            queues.insert(simple("n" + i));
        }
    }

    @Test
    void unlimited_promotesEverythingInOrder() {
        insertMany(5);
        clock.advanceMillis(100);

        queues.update(false);

        assertEquals(0, queues.lengthWaiting());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), ids(queues.getDisplayed()));
        for (QueuedNotification entry : queues.getDisplayed()) {
            assertEquals(10_100L, entry.getDisplayedAtMillis());
            assertEquals(QueueLocation.DISPLAYED, entry.getLocation());
        }
    }

    @Test
    void limit_isNeverExceeded() {
        queues.setDisplayedLimit(3);
        for (int round = 0; round < 4; round++) {
            insertMany(2);
            queues.update(false);
            assertTrue(queues.lengthDisplayed() <= 3);
        }
        assertEquals(3, queues.lengthDisplayed());
        assertEquals(5, queues.lengthWaiting());
    }

    @Test
    void limitFromConfig_appliesFromTheStart() {
        queues.close();
        queues = new NotificationQueueEngine(new QueueConfig().setDisplayedLimit(1), sink, clock);
        insertMany(3);

        queues.update(false);

        assertEquals(1, queues.lengthDisplayed());
        assertEquals(2, queues.lengthWaiting());
    }

    @Test
    void loweringLimit_doesNotEvictDisplayed() {
        insertMany(4);
        queues.update(false);

        queues.setDisplayedLimit(2);
        queues.update(false);
        assertEquals(4, queues.lengthDisplayed());

        queues.insert(simple("late"));
        queues.closeById(1, CloseReason.DISMISSED_BY_USER);
        queues.update(false);
        assertEquals(3, queues.lengthDisplayed());
        assertEquals(1, queues.lengthWaiting());
    }

    @Test
    void negativeLimit_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> queues.setDisplayedLimit(-1));
    }

    @Test
    void update_isIdempotentWhenNothingWaits() {
        insertMany(2);
        queues.update(false);
        List<Long> before = ids(queues.getDisplayed());

        queues.update(false);

        assertEquals(before, ids(queues.getDisplayed()));
    }

    @Test
    void paused_updateMovesNothing() {
        queues.setDisplayedLimit(2);
        insertMany(1);
        queues.update(false);
        insertMany(3);

        queues.pauseOn();
        assertTrue(queues.isPaused());
        queues.update(false);
        queues.update(true);

        assertEquals(1, queues.lengthDisplayed());
        assertEquals(3, queues.lengthWaiting());
    }

    @Test
    void paused_insertAndCloseStayLive() {
        queues.pauseOn();

        long a = queues.insert(simple("a"));
        long b = queues.insert(simple("b"));
        queues.closeById(a, CloseReason.DISMISSED_BY_USER);

        assertEquals(2, b);
        assertEquals(1, queues.lengthWaiting());
        assertEquals(1, queues.lengthHistory());
        assertEquals(1, sink.countFor(a));
    }

    @Test
    void pauseOff_promotesUpToLimit() {
        queues.setDisplayedLimit(2);
        queues.pauseOn();
        insertMany(3);
        queues.update(false);
        assertEquals(0, queues.lengthDisplayed());

        queues.pauseOff();
        assertFalse(queues.isPaused());
        queues.update(false);

        assertEquals(List.of(1L, 2L), ids(queues.getDisplayed()));
        assertEquals(1, queues.lengthWaiting());
    }

    @Test
    void fullscreen_delayedNotificationsStayWaiting() {
        queues.insert(builder("game over").fullscreen(FullscreenBehavior.DELAY).build());
        queues.insert(simple("chat"));

        queues.update(true);
        assertEquals(List.of(2L), ids(queues.getDisplayed()));
        assertEquals(List.of(1L), ids(queues.getWaiting()));

        queues.update(false);
        assertEquals(List.of(2L, 1L), ids(queues.getDisplayed()));
    }

    @Test
    void fullscreen_pushbackReturnsDisplayedToFrontOfWaiting() {
        queues.insert(builder("p1").fullscreen(FullscreenBehavior.PUSHBACK).build());
        queues.insert(simple("shown"));
        queues.insert(builder("p2").fullscreen(FullscreenBehavior.PUSHBACK).build());
        queues.update(false);
        queues.setDisplayedLimit(3);
        queues.insert(simple("queued"));

        queues.update(true);

        assertEquals(List.of(2L, 4L), ids(queues.getDisplayed()));
        assertEquals(List.of(1L, 3L), ids(queues.getWaiting()));
        assertEquals(QueuedNotification.UNSET, queues.getWaiting().get(0).getDisplayedAtMillis());
    }

    @Test
    void fullscreen_delayedNotificationsDoNotBlockLaterOnes() {
        queues.setDisplayedLimit(1);
        queues.insert(builder("delayed").fullscreen(FullscreenBehavior.DELAY).build());
        queues.insert(simple("shown"));

        queues.update(true);

        assertEquals(List.of(2L), ids(queues.getDisplayed()));
    }

    @Test
    void scenario_limitTwoThreeArrivalsOneExpires() {
        queues.setDisplayedLimit(2);
        long a = queues.insert(builder("A").timeoutMillis(1_000).build());
        long b = queues.insert(simple("B"));
        long c = queues.insert(simple("C"));
        assertEquals(List.of(1L, 2L, 3L), List.of(a, b, c));

        queues.update(false);
        assertEquals(List.of(a, b), ids(queues.getDisplayed()));
        assertEquals(List.of(c), ids(queues.getWaiting()));

        clock.advanceMillis(1_001);
        queues.checkTimeouts(false, false);
        assertEquals(List.of(a), ids(queues.getHistory()));
        assertEquals(List.of(b), ids(queues.getDisplayed()));

        queues.update(false);
        assertEquals(List.of(b, c), ids(queues.getDisplayed()));
        assertEquals(0, queues.lengthWaiting());
    }

    @Test
    void displayedView_isASnapshot() {
        insertMany(2);
        queues.update(false);
        List<QueuedNotification> view = queues.getDisplayed();

        queues.closeById(1, CloseReason.DISMISSED_BY_USER);

        assertEquals(2, view.size());
        assertEquals(1, queues.lengthDisplayed());
        assertThrows(UnsupportedOperationException.class, view::clear);
    }
}
