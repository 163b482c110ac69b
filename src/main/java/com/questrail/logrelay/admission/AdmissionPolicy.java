package com.questrail.logrelay.admission;

import java.time.Duration;
import java.util.Objects;

/**
 * AdmissionPolicy
 * -----------------------------------------------------------------------------
 * Fixed-window throttle parameters, applied per origin.
 *
 * <ul>
 *   <li><b>window</b> length of one counting window</li>
 *   <li><b>maxRequests</b> requests admitted per origin within one window</li>
 * </ul>
 */
public record AdmissionPolicy(Duration window, int maxRequests)
{
    public AdmissionPolicy {
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
    }

    /**
     * 100 requests per 15 minutes.
     */
    public static AdmissionPolicy defaults() {
        return new AdmissionPolicy(Duration.ofMinutes(15), 100);
    }
}
