package com.confluenceplatform.symbol.service;

import com.confluenceplatform.common.exception.SymbolNotFoundException;
import com.confluenceplatform.common.model.ConfluenceState;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.confluenceplatform.common.model.ViewBias;
import com.confluenceplatform.common.normalize.SymbolNormalizer;
import com.confluenceplatform.common.staleness.Staleness;
import com.confluenceplatform.common.staleness.StalenessEvaluator;
import com.confluenceplatform.symbol.config.ConfluenceProperties;
import com.confluenceplatform.symbol.dto.ConfluenceSummaryDTO;
import com.confluenceplatform.symbol.dto.LevelListDTO;
import com.confluenceplatform.symbol.dto.OpportunityDTO;
import com.confluenceplatform.symbol.dto.OpportunityListDTO;
import com.confluenceplatform.symbol.dto.PriceLevelDTO;
import com.confluenceplatform.symbol.dto.SourceViewDTO;
import com.confluenceplatform.symbol.dto.StalenessReportDTO;
import com.confluenceplatform.symbol.dto.SymbolDetailDTO;
import com.confluenceplatform.symbol.dto.SymbolListDTO;
import com.confluenceplatform.symbol.dto.SymbolSummaryDTO;
import com.confluenceplatform.symbol.dto.ViewSummaryDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the symbol API. Every answer is recomputed from the stores at call time;
 * staleness is evaluated against the injected {@link Clock}.
 */
@Service
public class SymbolQueryService {

    private static final Logger log = LoggerFactory.getLogger(SymbolQueryService.class);

    static final Comparator<PriceLevel> PRICE_DESCENDING = Comparator
        .comparingDouble(PriceLevel::price).reversed()
        .thenComparing(PriceLevel::id);

    private final ConfluenceService confluenceService;
    private final StalenessEvaluator stalenessEvaluator;
    private final ConfluenceProperties properties;
    private final Clock clock;

    public SymbolQueryService(ConfluenceService confluenceService,
                              StalenessEvaluator stalenessEvaluator,
                              ConfluenceProperties properties,
                              Clock clock) {
        this.confluenceService  = confluenceService;
        this.stalenessEvaluator = stalenessEvaluator;
        this.properties         = properties;
        this.clock              = clock;
    }

    /** Resolves raw symbol text through the normalizer; aliases and futures roots are accepted. */
    public static TrackedSymbol resolve(String symbolText) {
        return SymbolNormalizer.normalize(symbolText)
            .orElseThrow(() -> new SymbolNotFoundException(symbolText));
    }

    public Mono<SymbolListDTO> listSymbols() {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            List<SymbolSummaryDTO> rows = new ArrayList<>();
            for (TrackedSymbol symbol : TrackedSymbol.values()) {
                rows.add(summarize(confluenceService.evaluate(symbol, now), now));
            }
            return new SymbolListDTO(List.copyOf(rows), rows.size());
        });
    }

    public Mono<SymbolDetailDTO> getSymbol(String symbolText) {
        return Mono.fromCallable(() -> {
            TrackedSymbol symbol = resolve(symbolText);
            Instant now = clock.instant();
            ConfluenceService.Evaluation evaluation = confluenceService.evaluate(symbol, now);

            Map<String, SourceViewDTO> views = new LinkedHashMap<>();
            for (SourceView view : evaluation.snapshot().views()) {
                views.put(view.source().id(), toViewDto(view, now));
            }
            List<PriceLevelDTO> levels = evaluation.snapshot().activeLevels().stream()
                .sorted(PRICE_DESCENDING)
                .map(level -> toLevelDto(level, now))
                .toList();

            ConfluenceState state = evaluation.state();
            log.info("Symbol detail served. symbol={} views={} levels={} classification={} score={}",
                     symbol, views.size(), levels.size(), state.classification().id(), state.score());
            return new SymbolDetailDTO(symbol, symbol.assetClass(), views, levels, state,
                                       state.tradeSetup(), now);
        });
    }

    /**
     * Active levels of one symbol, price descending.
     *
     * @param sourceId optional source filter; an unknown id is a bad request
     */
    public Mono<LevelListDTO> getLevels(String symbolText, String sourceId) {
        return Mono.fromCallable(() -> {
            TrackedSymbol symbol = resolve(symbolText);
            SignalSource source = null;
            if (sourceId != null && !sourceId.isBlank()) {
                source = SignalSource.fromId(sourceId);
                if (source == null) {
                    throw new IllegalArgumentException("Unknown source: " + sourceId);
                }
            }
            SignalSource filter = source;
            Instant now = clock.instant();
            List<PriceLevelDTO> levels = confluenceService.snapshot(symbol).activeLevels().stream()
                .filter(level -> filter == null || level.source() == filter)
                .sorted(PRICE_DESCENDING)
                .map(level -> toLevelDto(level, now))
                .toList();
            return new LevelListDTO(symbol, filter, levels, levels.size());
        });
    }

    /** Aligned symbols scoring at or above the HIGH threshold, score descending. */
    public Mono<OpportunityListDTO> opportunities() {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            double minScore = properties.getScoring().getHighThreshold();
            List<OpportunityDTO> opportunities = new ArrayList<>();
            for (TrackedSymbol symbol : TrackedSymbol.values()) {
                ConfluenceService.Evaluation evaluation = confluenceService.evaluate(symbol, now);
                ConfluenceState state = evaluation.state();
                if (!state.aligned() || state.score() < minScore) {
                    continue;
                }
                Map<String, ViewBias> biases = new LinkedHashMap<>();
                for (SourceView view : evaluation.snapshot().views()) {
                    if (state.contributingSources().contains(view.source())) {
                        biases.put(view.source().id(), view.bias());
                    }
                }
                opportunities.add(new OpportunityDTO(symbol, state.score(), state.classification(),
                                                     state.summary(), state.tradeSetup(), biases));
            }
            opportunities.sort(Comparator.comparingDouble(OpportunityDTO::score).reversed()
                .thenComparing(OpportunityDTO::symbol));
            log.info("Confluence opportunities computed. count={} minScore={}", opportunities.size(), minScore);
            return new OpportunityListDTO(List.copyOf(opportunities), opportunities.size(), minScore);
        });
    }

    /**
     * Sweeps the catalog and reports which views and levels have aged past their thresholds.
     * Nothing is written; staleness is always derived at read time.
     */
    public Mono<StalenessReportDTO> refreshStaleness() {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            Map<String, List<String>> stale = new LinkedHashMap<>();
            Map<String, List<String>> expired = new LinkedHashMap<>();
            List<String> aligned = new ArrayList<>();
            int staleLevels = 0;

            for (TrackedSymbol symbol : TrackedSymbol.values()) {
                ConfluenceService.Evaluation evaluation = confluenceService.evaluate(symbol, now);
                for (SourceView view : evaluation.snapshot().views()) {
                    Staleness staleness = stalenessEvaluator.evaluate(view, now);
                    if (staleness == Staleness.EXPIRED) {
                        expired.computeIfAbsent(view.source().id(), k -> new ArrayList<>()).add(symbol.name());
                    } else if (staleness == Staleness.STALE) {
                        stale.computeIfAbsent(view.source().id(), k -> new ArrayList<>()).add(symbol.name());
                    }
                }
                staleLevels += (int) evaluation.snapshot().activeLevels().stream()
                    .filter(level -> stalenessEvaluator.isStale(level, now))
                    .count();
                if (evaluation.state().aligned()) {
                    aligned.add(symbol.name());
                }
            }

            log.info("Staleness sweep complete. staleSources={} expiredSources={} staleLevels={} aligned={}",
                     stale.keySet(), expired.keySet(), staleLevels, aligned);
            return new StalenessReportDTO(now, TrackedSymbol.values().length, stale, expired,
                                          staleLevels, List.copyOf(aligned));
        });
    }

    // ── mapping ───────────────────────────────────────────────────────────

    private SymbolSummaryDTO summarize(ConfluenceService.Evaluation evaluation, Instant now) {
        TrackedSymbol symbol = evaluation.snapshot().symbol();
        Map<String, ViewSummaryDTO> views = new LinkedHashMap<>();
        for (SourceView view : evaluation.snapshot().views()) {
            Staleness staleness = stalenessEvaluator.evaluate(view, now);
            views.put(view.source().id(), new ViewSummaryDTO(
                view.bias(), view.quadrant(), view.ivRegime(), view.wavePosition(), view.wavePhase(),
                view.lastUpdatedAt(), staleness, staleness.isStale(),
                stalenessEvaluator.stalenessMessage(view.source(), view.lastUpdatedAt(), now)));
        }
        return new SymbolSummaryDTO(symbol, symbol.assetClass(), views,
                                    ConfluenceSummaryDTO.from(evaluation.state()),
                                    evaluation.snapshot().activeLevels().size());
    }

    private SourceViewDTO toViewDto(SourceView view, Instant now) {
        Staleness staleness = stalenessEvaluator.evaluate(view, now);
        return new SourceViewDTO(view, staleness, staleness.isStale(),
                                 StalenessEvaluator.hoursSince(view.lastUpdatedAt(), now),
                                 stalenessEvaluator.stalenessMessage(view.source(), view.lastUpdatedAt(), now));
    }

    private PriceLevelDTO toLevelDto(PriceLevel level, Instant now) {
        Staleness staleness = stalenessEvaluator.evaluate(level, now);
        return new PriceLevelDTO(level, staleness, staleness.isStale(),
                                 StalenessEvaluator.hoursSince(level.lastConfirmedAt(), now));
    }
}
