package com.questrail.logrelay.admission;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionLimiterTest {

    private static final long WINDOW_MILLIS = Duration.ofMinutes(15).toMillis();

    private final AdmissionLimiter limiter = new AdmissionLimiter(AdmissionPolicy.defaults());

    @Test
    void admitsUpToMaxRequestsThenRejects() {
        long start = 1_000L;
        for (int i = 0; i < 100; i++) {
            assertTrue(limiter.admit("10.0.0.1", start).allowed(), "request " + (i + 1));
        }

        AdmissionDecision decision = limiter.admit("10.0.0.1", start);

        assertFalse(decision.allowed());
        AdmissionDecision.Rejected rejected = (AdmissionDecision.Rejected) decision;
        assertEquals(900, rejected.retryAfterSeconds());
        assertEquals("Retry after 900 seconds", rejected.failure().details().orElseThrow());
    }

    @Test
    void retryAfterRoundsRemainingTimeUp() {
        AdmissionLimiter strict = new AdmissionLimiter(new AdmissionPolicy(Duration.ofSeconds(10), 1));
        strict.admit("origin", 0);

        AdmissionDecision.Rejected rejected = (AdmissionDecision.Rejected) strict.admit("origin", 8_500);

        assertEquals(2, rejected.retryAfterSeconds());
    }

    @Test
    void originsAreCountedSeparately() {
        AdmissionLimiter strict = new AdmissionLimiter(new AdmissionPolicy(Duration.ofMinutes(1), 1));

        assertTrue(strict.admit("a", 0).allowed());
        assertTrue(strict.admit("b", 0).allowed());
        assertFalse(strict.admit("a", 1).allowed());
    }

    @Test
    void newWindowOpensAtResetTime() {
        for (int i = 0; i < 101; i++) {
            limiter.admit("10.0.0.1", 0);
        }
        assertFalse(limiter.admit("10.0.0.1", WINDOW_MILLIS - 1).allowed());

        assertTrue(limiter.admit("10.0.0.1", WINDOW_MILLIS).allowed());
    }

    @Test
    void expiredWindowsArePurged() {
        limiter.admit("a", 0);
        limiter.admit("b", 0);
        assertEquals(2, limiter.trackedOrigins());

        limiter.admit("c", WINDOW_MILLIS);

        assertEquals(1, limiter.trackedOrigins());
    }
}
