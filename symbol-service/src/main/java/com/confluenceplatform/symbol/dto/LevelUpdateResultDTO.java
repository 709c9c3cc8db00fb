package com.confluenceplatform.symbol.dto;

import com.confluenceplatform.common.model.PriceLevel;

import java.util.List;

/**
 * @param level             the level after the edit, possibly with neighbours folded in
 * @param absorbedLevelIds  levels deactivated because the edit moved this one into their band
 */
public record LevelUpdateResultDTO(
    PriceLevel level,
    List<Long> absorbedLevelIds
) {}
