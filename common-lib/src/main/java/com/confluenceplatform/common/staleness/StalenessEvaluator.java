package com.confluenceplatform.common.staleness;

import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.SourceView;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pure staleness classification with per-source thresholds.
 *
 * <pre>
 *   age = now − lastUpdatedAt   (views)
 *   age = now − lastConfirmedAt (levels)
 *
 *   age &gt; hard   → EXPIRED
 *   age ≥ soft   → STALE
 *   otherwise    → FRESH
 * </pre>
 * A reference time in the future is treated as age zero. A missing reference time is
 * EXPIRED: there is nothing to vouch for the data.
 *
 * <p>Thresholds are configuration; sources without an explicit policy use the fallback.
 */
public final class StalenessEvaluator {

    static final Duration ONE_WEEK = Duration.ofDays(7);

    private final Map<SignalSource, StalenessPolicy> policies;
    private final StalenessPolicy fallback;

    public StalenessEvaluator(Map<SignalSource, StalenessPolicy> policies, StalenessPolicy fallback) {
        this.policies = policies.isEmpty()
            ? new EnumMap<>(SignalSource.class)
            : new EnumMap<>(policies);
        this.fallback = fallback;
    }

    /** Default cadence-based thresholds: weekly publishers tolerate longer gaps than daily ones. */
    public static StalenessEvaluator defaults() {
        Map<SignalSource, StalenessPolicy> policies = new EnumMap<>(SignalSource.class);
        policies.put(SignalSource.KT_TECHNICAL, StalenessPolicy.of(Duration.ofDays(7),   Duration.ofDays(21)));
        policies.put(SignalSource.DISCORD,      StalenessPolicy.of(Duration.ofHours(48), Duration.ofDays(7)));
        policies.put(SignalSource.MACRO42,      StalenessPolicy.of(Duration.ofDays(7),   Duration.ofDays(21)));
        policies.put(SignalSource.YOUTUBE,      StalenessPolicy.of(Duration.ofHours(72), Duration.ofDays(14)));
        policies.put(SignalSource.SUBSTACK,     StalenessPolicy.of(Duration.ofDays(7),   Duration.ofDays(21)));
        policies.put(SignalSource.TWITTER,      StalenessPolicy.of(Duration.ofHours(24), Duration.ofHours(72)));
        return new StalenessEvaluator(policies, StalenessPolicy.of(Duration.ofHours(48), Duration.ofDays(14)));
    }

    public StalenessPolicy policyFor(SignalSource source) {
        return policies.getOrDefault(source, fallback);
    }

    public Staleness evaluate(SignalSource source, Instant reference, Instant now) {
        if (reference == null) {
            return Staleness.EXPIRED;
        }
        StalenessPolicy policy = policyFor(source);
        Duration age = age(reference, now);
        if (age.compareTo(policy.hard()) > 0) return Staleness.EXPIRED;
        if (age.compareTo(policy.soft()) >= 0) return Staleness.STALE;
        return Staleness.FRESH;
    }

    public Staleness evaluate(SourceView view, Instant now) {
        return evaluate(view.source(), view.lastUpdatedAt(), now);
    }

    public Staleness evaluate(PriceLevel level, Instant now) {
        return evaluate(level.source(), level.lastConfirmedAt(), now);
    }

    public boolean isStale(SourceView view, Instant now) {
        return evaluate(view, now).isStale();
    }

    public boolean isStale(PriceLevel level, Instant now) {
        return evaluate(level, now).isStale();
    }

    /**
     * Human-readable age warning, or {@code null} when the data is fresh.
     * Ages under a week are reported in whole hours ("36h old"), older ones in days.
     */
    public String stalenessMessage(SignalSource source, Instant reference, Instant now) {
        if (reference == null) {
            return "Never updated";
        }
        if (!evaluate(source, reference, now).isStale()) {
            return null;
        }
        Duration age = age(reference, now);
        if (age.compareTo(ONE_WEEK) < 0) {
            return age.toHours() + "h old";
        }
        return age.toDays() + " days old";
    }

    /** Age rounded to one decimal hour, {@code null} when there is no reference time. */
    public static Double hoursSince(Instant reference, Instant now) {
        if (reference == null) return null;
        double hours = age(reference, now).toSeconds() / 3600.0;
        return Math.round(hours * 10.0) / 10.0;
    }

    private static Duration age(Instant reference, Instant now) {
        Duration age = Duration.between(reference, now);
        return age.isNegative() ? Duration.ZERO : age;
    }
}
