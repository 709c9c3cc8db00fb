package com.confluenceplatform.common.staleness;

import java.time.Duration;

/**
 * Soft (warn) and hard (exclude) age thresholds for one source.
 */
public record StalenessPolicy(Duration soft, Duration hard) {

    public StalenessPolicy {
        if (soft == null || hard == null) {
            throw new IllegalArgumentException("soft and hard thresholds are required");
        }
        if (soft.isNegative() || hard.compareTo(soft) < 0) {
            throw new IllegalArgumentException("expected 0 <= soft <= hard, got soft=" + soft + " hard=" + hard);
        }
    }

    public static StalenessPolicy of(Duration soft, Duration hard) {
        return new StalenessPolicy(soft, hard);
    }
}
