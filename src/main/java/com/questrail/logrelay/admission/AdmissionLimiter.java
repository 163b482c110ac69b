package com.questrail.logrelay.admission;

import com.questrail.logrelay.api.RelayFailure.RateLimitExceeded;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * AdmissionLimiter
 * =============================================================================
 * Per-origin fixed-window request throttle.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>The first request from an origin, or the first one at or after the
 *       current window's reset time, opens a new window with count 1.</li>
 *   <li>Otherwise the count increments; once it exceeds
 *       {@link AdmissionPolicy#maxRequests()} the request is rejected with the
 *       whole seconds remaining until the window resets.</li>
 *   <li>Windows whose reset time has passed are purged lazily on access.</li>
 * </ul>
 *
 * <p>A burst straddling a window
 * boundary may see up to twice the nominal allowance.</p>
 *
 * <h2>Thread safety</h2>
 * Each origin's window is updated atomically; callers on different event-loop
 * threads may admit concurrently.
 */
public final class AdmissionLimiter
{
    private static final Logger log = LoggerFactory.getLogger(AdmissionLimiter.class);

    private final AdmissionPolicy policy;
    private final ConcurrentMap<String, RateWindow> windows = new ConcurrentHashMap<>();

    public AdmissionLimiter(AdmissionPolicy policy)
    {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Count one request from {@code originId} and decide whether to admit it.
     *
     * @param originId  the requesting origin, typically a remote address
     * @param nowMillis current monotonic time in milliseconds
     */
    public AdmissionDecision admit(String originId, long nowMillis)
    {
        Objects.requireNonNull(originId, "originId");
        purgeExpired(nowMillis);

        long windowMillis = policy.window().toMillis();
        RateWindow window = windows.compute(originId, (origin, current) -> {
            if (current == null || nowMillis >= current.resetAtMillis()) {
                return new RateWindow(1, nowMillis + windowMillis);
            }
            return current.increment();
        });

        if (window.count() <= policy.maxRequests()) {
            return AdmissionDecision.Allowed.INSTANCE;
        }

        long remainingMillis = Math.max(0, window.resetAtMillis() - nowMillis);
        long retryAfterSeconds = (remainingMillis + 999) / 1000;
        log.warn("Rate limit exceeded for origin {} (count={}, retryAfter={}s)",
                originId, window.count(), retryAfterSeconds);
        return new AdmissionDecision.Rejected(new RateLimitExceeded(retryAfterSeconds));
    }

    /**
     * Number of origins with a live window.
     */
    public int trackedOrigins()
    {
        return windows.size();
    }

    private void purgeExpired(long nowMillis)
    {
        windows.values().removeIf(w -> nowMillis >= w.resetAtMillis());
    }

    /**
     * Request count within a window and the instant the window resets.
     */
    record RateWindow(int count, long resetAtMillis)
    {
        RateWindow increment() {
            // Saturate rather than wrap for a pathological origin.
            return new RateWindow(count == Integer.MAX_VALUE ? count : count + 1, resetAtMillis);
        }
    }
}
