package com.confluenceplatform.symbol.service;

import com.confluenceplatform.common.level.LevelMergeResult;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.symbol.dto.LevelUpdateRequest;
import com.confluenceplatform.symbol.dto.LevelUpdateResultDTO;
import com.confluenceplatform.symbol.exception.LevelNotFoundException;
import com.confluenceplatform.symbol.store.LevelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Manual corrections to stored levels: edit price / type / direction / active flag, or
 * dismiss. A dismissed level stays stored but no longer counts anywhere.
 */
@Service
public class LevelOverrideService {

    private static final Logger log = LoggerFactory.getLogger(LevelOverrideService.class);

    private final LevelStore levelStore;

    public LevelOverrideService(LevelStore levelStore) {
        this.levelStore = levelStore;
    }

    public Mono<LevelUpdateResultDTO> update(long levelId, LevelUpdateRequest request) {
        return Mono.fromCallable(() -> {
            validate(request);
            LevelMergeResult result = levelStore.edit(levelId, level ->
                    level.withOverrides(request.price(), request.type(), request.direction(), request.active()))
                .orElseThrow(() -> new LevelNotFoundException(levelId));
            log.info("Level override applied. levelId={} price={} type={} direction={} active={}",
                     levelId, request.price(), request.type(), request.direction(), request.active());
            return toResult(result);
        });
    }

    public Mono<LevelUpdateResultDTO> dismiss(long levelId) {
        return Mono.fromCallable(() -> {
            LevelMergeResult result = levelStore.edit(levelId, level -> level.deactivated(PriceLevel.DISMISSED))
                .orElseThrow(() -> new LevelNotFoundException(levelId));
            log.info("Level dismissed. levelId={} symbol={} source={}",
                     levelId, result.survivor().symbol(), result.survivor().source().id());
            return toResult(result);
        });
    }

    private static void validate(LevelUpdateRequest request) {
        if (request == null || request.isEmpty()) {
            throw new IllegalArgumentException("At least one of price, type, direction, active is required");
        }
        if (request.price() != null && (request.price().isNaN() || request.price() <= 0.0)) {
            throw new IllegalArgumentException("price must be positive, was " + request.price());
        }
    }

    private static LevelUpdateResultDTO toResult(LevelMergeResult result) {
        return new LevelUpdateResultDTO(result.survivor(),
                                        result.superseded().stream().map(PriceLevel::id).toList());
    }
}
