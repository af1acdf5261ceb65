package dev.notifyqueue.config;

import dev.notifyqueue.model.CloseReason;
import dev.notifyqueue.model.Urgency;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.EnumSet;
import java.util.Set;

@Getter
@Setter
@Accessors(chain = true)
public class QueueConfig {
    // System property helpers for deployment/test overrides (safe fallbacks)
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Integer.parseInt(v.trim()); } catch (NumberFormatException e) { return def; }
    }
    private static long longProp(String key, long def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Long.parseLong(v.trim()); } catch (NumberFormatException e) { return def; }
    }

    // Identity
    private String name = prop("nq.name", "default");

    // Display
    private int displayedLimit = intProp("nq.displayedLimit", 0); // 0 = unlimited

    // Timeouts (millis, 0 = never expire)
    private long lowTimeoutMillis = longProp("nq.timeout.low", 10_000L);
    private long normalTimeoutMillis = longProp("nq.timeout.normal", 10_000L);
    private long criticalTimeoutMillis = longProp("nq.timeout.critical", 0L);
    private long transientTimeoutMillis = longProp("nq.timeout.transient", 10_000L); // cap for transient, 0 = no cap
    private long showAgeThresholdMillis = longProp("nq.showAgeThreshold", 60_000L); // negative disables age updates

    // History
    private int historyLength = intProp("nq.historyLength", 0); // 0 = unlimited
    private boolean stickyHistory = boolProp("nq.stickyHistory", false);
    private Set<CloseReason> historyReasons = EnumSet.complementOf(EnumSet.of(CloseReason.REPLACED));

    // Stacking
    private boolean stackDuplicates = boolProp("nq.stackDuplicates", true);

    // Fullscreen
    private Set<Urgency> fullscreenHoldUrgencies = EnumSet.noneOf(Urgency.class);

    /**
     * Default timeout for the given urgency, before transient capping and per-notification overrides.
     */
    public long timeoutFor(Urgency urgency) {
        switch (urgency) {
            case LOW:
                return lowTimeoutMillis;
            case CRITICAL:
                return criticalTimeoutMillis;
            case NORMAL:
            default:
                return normalTimeoutMillis;
        }
    }

    /**
     * Whether a notification closed for the given reason is archived in history.
     */
    public boolean isHistoryEligible(CloseReason reason) {
        return historyReasons.contains(reason);
    }
}
