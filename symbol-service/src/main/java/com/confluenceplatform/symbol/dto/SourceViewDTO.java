package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.staleness.Staleness;

/**
 * A stored view with its staleness evaluated at read time.
 *
 * @param hoursSinceUpdate age in hours, one decimal
 * @param staleWarning     "36h old" / "9 days old", null when fresh
 */
public record SourceViewDTO(
    SourceView view,
    Staleness  staleness,
    boolean    stale,
    Double     hoursSinceUpdate,
    String     staleWarning
) {}
