package com.questrail.logrelay.observability;

/**
 * Lifecycle phase of a key's poller.
 */
public enum PollerPhase {
    /** No subscribers; no poller exists. */
    ABSENT,

    /** Ticks are scheduled and relayed. */
    ACTIVE,

    /** Gave up after too many consecutive failures; waits for a re-subscription. */
    STOPPED_ON_ERROR
}
