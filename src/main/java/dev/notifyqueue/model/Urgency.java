package dev.notifyqueue.model;

/**
 * Urgency levels as defined by the desktop notification protocol, ordered from least to most urgent.
 */
public enum Urgency {
    LOW,
    NORMAL,
    CRITICAL
}
