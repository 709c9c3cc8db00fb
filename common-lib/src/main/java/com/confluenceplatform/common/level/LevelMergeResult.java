package com.confluenceplatform.common.level;

import com.confluenceplatform.common.model.PriceLevel;

import java.util.List;

/**
 * Outcome of applying one level candidate to a (symbol, source, type) bucket.
 *
 * <ul>
 *   <li>{@code survivor}   — level to store; {@code id == null} when {@link Outcome#INSERTED},
 *                            the stored level unchanged when {@link Outcome#STALE_WRITE_IGNORED}</li>
 *   <li>{@code superseded} — previously active levels folded into the survivor, already deactivated</li>
 * </ul>
 */
public record LevelMergeResult(
    Outcome outcome,
    PriceLevel survivor,
    List<PriceLevel> superseded
) {
    public enum Outcome {
        INSERTED,
        MERGED,
        STALE_WRITE_IGNORED
    }
}
