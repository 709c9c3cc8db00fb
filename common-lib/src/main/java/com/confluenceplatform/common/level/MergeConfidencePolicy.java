package com.confluenceplatform.common.level;

/**
 * How the confidence of a merged level is derived from the two observations.
 * {@link #MAX} is the default; {@link #MIN} is the conservative lower-bound policy.
 */
public enum MergeConfidencePolicy {
    MAX,
    MIN;

    public double combine(double existing, double incoming) {
        return this == MIN ? Math.min(existing, incoming) : Math.max(existing, incoming);
    }
}
