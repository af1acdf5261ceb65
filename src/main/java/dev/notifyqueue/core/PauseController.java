package dev.notifyqueue.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gate on the waiting to displayed promotion. Nothing else consults it.
 */
final class PauseController {
    private static final Logger logger = LoggerFactory.getLogger(PauseController.class);

    private boolean paused;

    void pause() {
        if (!paused) {
            logger.info("Notification display paused");
        }
        paused = true;
    }

    void resume() {
        if (paused) {
            logger.info("Notification display resumed");
        }
        paused = false;
    }

    boolean isPaused() {
        return paused;
    }
}
