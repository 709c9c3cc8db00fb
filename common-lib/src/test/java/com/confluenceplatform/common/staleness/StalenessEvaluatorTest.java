package com.confluenceplatform.common.staleness;

import com.confluenceplatform.common.model.LevelType;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.ViewBias;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static com.confluenceplatform.common.support.Fixtures.T0;
import static com.confluenceplatform.common.support.Fixtures.level;
import static com.confluenceplatform.common.support.Fixtures.view;
import static org.junit.jupiter.api.Assertions.*;

class StalenessEvaluatorTest {

    private final StalenessEvaluator evaluator = StalenessEvaluator.defaults();

    @Nested
    @DisplayName("evaluate() — discord: soft 48h, hard 7d")
    class BoundaryTests {

        @Test
        @DisplayName("just under the soft threshold → FRESH")
        void justUnderSoft() {
            assertEquals(Staleness.FRESH,
                evaluator.evaluate(SignalSource.DISCORD, T0, T0.plus(Duration.ofHours(48)).minusSeconds(1)));
        }

        @Test
        @DisplayName("exactly at the soft threshold → STALE")
        void exactlySoft() {
            assertEquals(Staleness.STALE,
                evaluator.evaluate(SignalSource.DISCORD, T0, T0.plus(Duration.ofHours(48))));
        }

        @Test
        @DisplayName("exactly at the hard threshold → still STALE")
        void exactlyHard() {
            assertEquals(Staleness.STALE,
                evaluator.evaluate(SignalSource.DISCORD, T0, T0.plus(Duration.ofDays(7))));
        }

        @Test
        @DisplayName("past the hard threshold → EXPIRED")
        void pastHard() {
            assertEquals(Staleness.EXPIRED,
                evaluator.evaluate(SignalSource.DISCORD, T0, T0.plus(Duration.ofDays(7)).plusSeconds(1)));
        }

        @Test
        @DisplayName("missing reference → EXPIRED; future reference → FRESH")
        void missingAndFuture() {
            assertEquals(Staleness.EXPIRED, evaluator.evaluate(SignalSource.DISCORD, null, T0));
            assertEquals(Staleness.FRESH,
                evaluator.evaluate(SignalSource.DISCORD, T0.plus(Duration.ofHours(1)), T0));
        }
    }

    @Nested
    @DisplayName("per-source cadence")
    class CadenceTests {

        @Test
        @DisplayName("same age: weekly publisher fresh, daily publisher stale")
        void cadenceMatters() {
            Instant now = T0.plus(Duration.ofHours(60));
            assertEquals(Staleness.FRESH, evaluator.evaluate(view(SignalSource.KT_TECHNICAL, ViewBias.BULLISH, 0.8, T0), now));
            assertEquals(Staleness.STALE, evaluator.evaluate(view(SignalSource.DISCORD, ViewBias.BULLISH, 0.8, T0), now));
            assertEquals(Staleness.STALE, evaluator.evaluate(view(SignalSource.TWITTER, ViewBias.BULLISH, 0.8, T0), now));
        }

        @Test
        @DisplayName("levels age from lastConfirmedAt")
        void levelsUseLastConfirmed() {
            Instant now = T0.plus(Duration.ofDays(22));
            assertEquals(Staleness.EXPIRED,
                evaluator.evaluate(level(1L, SignalSource.SUBSTACK, LevelType.SUPPORT, 100, 0.8, T0), now));
            assertTrue(evaluator.isStale(level(1L, SignalSource.SUBSTACK, LevelType.SUPPORT, 100, 0.8, T0), now));
        }

        @Test
        @DisplayName("sources without a policy use the fallback")
        void fallbackPolicy() {
            StalenessEvaluator custom = new StalenessEvaluator(
                Map.of(SignalSource.DISCORD, StalenessPolicy.of(Duration.ofHours(1), Duration.ofHours(2))),
                StalenessPolicy.of(Duration.ofHours(10), Duration.ofHours(20)));

            assertEquals(Staleness.EXPIRED, custom.evaluate(SignalSource.DISCORD, T0, T0.plus(Duration.ofHours(3))));
            assertEquals(Staleness.FRESH, custom.evaluate(SignalSource.MACRO42, T0, T0.plus(Duration.ofHours(3))));
        }

        @Test
        @DisplayName("soft threshold above hard is rejected")
        void invalidPolicy() {
            assertThrows(IllegalArgumentException.class,
                () -> StalenessPolicy.of(Duration.ofDays(2), Duration.ofDays(1)));
        }
    }

    @Nested
    @DisplayName("stalenessMessage() / hoursSince()")
    class MessageTests {

        @Test
        @DisplayName("fresh → null")
        void freshHasNoMessage() {
            assertNull(evaluator.stalenessMessage(SignalSource.DISCORD, T0, T0.plus(Duration.ofHours(3))));
        }

        @Test
        @DisplayName("under a week → hours")
        void hoursMessage() {
            assertEquals("50h old",
                evaluator.stalenessMessage(SignalSource.DISCORD, T0, T0.plus(Duration.ofHours(50))));
        }

        @Test
        @DisplayName("a week or more → days")
        void daysMessage() {
            assertEquals("10 days old",
                evaluator.stalenessMessage(SignalSource.KT_TECHNICAL, T0, T0.plus(Duration.ofDays(10))));
        }

        @Test
        @DisplayName("never updated")
        void neverUpdated() {
            assertEquals("Never updated", evaluator.stalenessMessage(SignalSource.DISCORD, null, T0));
        }

        @Test
        @DisplayName("hours rounded to one decimal")
        void hoursRounded() {
            assertEquals(1.5, StalenessEvaluator.hoursSince(T0, T0.plus(Duration.ofMinutes(90))));
            assertNull(StalenessEvaluator.hoursSince(null, T0));
        }
    }
}
