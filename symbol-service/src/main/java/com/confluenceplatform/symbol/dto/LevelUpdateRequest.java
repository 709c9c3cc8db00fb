package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.LevelDirection;
import com.confluenceplatform.common.model.LevelType;

/**
 * Body of {@code PATCH /api/v1/symbols/levels/{levelId}}. Null fields are left unchanged.
 */
public record LevelUpdateRequest(
    Double         price,
    LevelType      type,
    LevelDirection direction,
    Boolean        active
) {
    public boolean isEmpty() {
        return price == null && type == null && direction == null && active == null;
    }
}
