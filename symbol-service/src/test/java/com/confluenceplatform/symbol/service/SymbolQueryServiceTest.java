package com.confluenceplatform.symbol.service;

import com.confluenceplatform.common.event.ExtractionRecord;
import com.confluenceplatform.common.exception.SymbolNotFoundException;
import com.confluenceplatform.common.model.ConfluenceClassification;
import com.confluenceplatform.common.model.LevelType;
import com.confluenceplatform.common.model.OptionsQuadrant;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.confluenceplatform.common.model.ViewBias;
import com.confluenceplatform.common.staleness.Staleness;
import com.confluenceplatform.symbol.dto.LevelListDTO;
import com.confluenceplatform.symbol.dto.OpportunityListDTO;
import com.confluenceplatform.symbol.dto.StalenessReportDTO;
import com.confluenceplatform.symbol.dto.SymbolDetailDTO;
import com.confluenceplatform.symbol.dto.SymbolListDTO;
import com.confluenceplatform.symbol.dto.SymbolSummaryDTO;
import com.confluenceplatform.symbol.support.SymbolServiceFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static com.confluenceplatform.symbol.support.SymbolServiceFixture.T0;
import static com.confluenceplatform.symbol.support.SymbolServiceFixture.levelRecord;
import static com.confluenceplatform.symbol.support.SymbolServiceFixture.viewRecord;
import static org.junit.jupiter.api.Assertions.*;

class SymbolQueryServiceTest {

    private SymbolServiceFixture fx;
    private SymbolQueryService queryService;

    @BeforeEach
    void setUp() {
        fx = new SymbolServiceFixture();
        queryService = fx.queryService;
    }

    /**
     * KT bullish view plus a Discord buy_call view carrying no explicit bias, with converging
     * support levels.
     */
    private void seedAlignedSpx() {
        fx.ingestionService.ingestBatch(List.of(
            viewRecord("SPX", SignalSource.KT_TECHNICAL, ViewBias.BULLISH, T0),
            ExtractionRecord.view("/ES", SignalSource.DISCORD,
                ExtractionRecord.ViewFields.ofQuadrant(OptionsQuadrant.BUY_CALL, "cheap", 0.8),
                "discord-buy-call", T0),
            levelRecord("SPX", SignalSource.KT_TECHNICAL, LevelType.SUPPORT, 5000, 0.8, T0),
            levelRecord("SPY", SignalSource.DISCORD, LevelType.SUPPORT, 5010, 0.7, T0),
            levelRecord("SPX", SignalSource.KT_TECHNICAL, LevelType.TARGET, 5200, 0.9, T0)
        )).block();
        fx.clock.advance(Duration.ofHours(1));
    }

    @Nested
    @DisplayName("getSymbol()")
    class DetailTests {

        @Test
        @DisplayName("aligned symbol: HIGH confluence, levels price-descending, trade setup present")
        void alignedDetail() {
            seedAlignedSpx();

            SymbolDetailDTO detail = queryService.getSymbol("spx").block();

            assertEquals(TrackedSymbol.SPX, detail.symbol());
            assertEquals(List.of("kt_technical", "discord"), List.copyOf(detail.views().keySet()));
            assertEquals(List.of(5200.0, 5010.0, 5000.0),
                         detail.levels().stream().map(l -> l.level().price()).toList());
            assertEquals(ConfluenceClassification.HIGH, detail.confluence().classification());
            assertEquals(1.0, detail.confluence().score(), 1e-9);
            assertTrue(detail.confluence().aligned());
            assertEquals(OptionsQuadrant.BUY_CALL, detail.views().get("discord").view().quadrant());
            assertEquals(ViewBias.BULLISH, detail.views().get("discord").view().bias());
            assertNotNull(detail.tradeSetup());
            assertTrue(detail.tradeSetup().startsWith("LONG setup on SPX"));
            assertTrue(detail.tradeSetup().contains("kt_technical and discord bullish"));
            assertEquals(Staleness.FRESH, detail.views().get("discord").staleness());
            assertEquals(1.0, detail.views().get("discord").hoursSinceUpdate());
        }

        @Test
        @DisplayName("futures alias resolves to the catalog symbol")
        void aliasResolves() {
            StepVerifier.create(queryService.getSymbol("NQ=F"))
                .assertNext(d -> assertEquals(TrackedSymbol.QQQ, d.symbol()))
                .verifyComplete();
        }

        @Test
        @DisplayName("unknown symbol → SymbolNotFoundException")
        void unknownSymbol() {
            StepVerifier.create(queryService.getSymbol("/GC"))
                .expectError(SymbolNotFoundException.class)
                .verify();
        }

        @Test
        @DisplayName("views age into STALE and the score drops without any ingestion")
        void agingWithoutIngestion() {
            seedAlignedSpx();
            fx.clock.advance(Duration.ofHours(48));

            SymbolDetailDTO detail = queryService.getSymbol("SPX").block();

            assertEquals(Staleness.STALE, detail.views().get("discord").staleness());
            assertEquals("49h old", detail.views().get("discord").staleWarning());
            assertEquals(List.of(SignalSource.DISCORD), detail.confluence().staleSources());
            assertTrue(detail.confluence().score() < 1.0);
        }

        @Test
        @DisplayName("corroborating view past its hard cutoff → NONE, not aligned, no setup")
        void corroborationExpires() {
            seedAlignedSpx();
            assertTrue(queryService.getSymbol("SPX").block().confluence().aligned());

            fx.clock.advance(Duration.ofDays(7).minusHours(1).plusSeconds(1));
            SymbolDetailDTO detail = queryService.getSymbol("SPX").block();

            assertEquals(Staleness.EXPIRED, detail.views().get("discord").staleness());
            assertEquals(ConfluenceClassification.NONE, detail.confluence().classification());
            assertFalse(detail.confluence().aligned());
            assertNull(detail.tradeSetup());
            assertEquals(List.of(SignalSource.KT_TECHNICAL), detail.confluence().contributingSources());
        }
    }

    @Nested
    @DisplayName("listSymbols()")
    class ListTests {

        @Test
        @DisplayName("every catalog symbol present, empty ones with NONE confluence")
        void fullCatalog() {
            seedAlignedSpx();

            SymbolListDTO list = queryService.listSymbols().block();

            assertEquals(TrackedSymbol.values().length, list.count());
            SymbolSummaryDTO spx = list.symbols().get(0);
            assertEquals(TrackedSymbol.SPX, spx.symbol());
            assertEquals(3, spx.activeLevelCount());
            assertEquals(ViewBias.BULLISH, spx.views().get("kt_technical").bias());

            SymbolSummaryDTO amzn = list.symbols().stream()
                .filter(s -> s.symbol() == TrackedSymbol.AMZN).findFirst().orElseThrow();
            assertTrue(amzn.views().isEmpty());
            assertEquals(ConfluenceClassification.NONE, amzn.confluence().classification());
            assertEquals(0, amzn.activeLevelCount());
        }
    }

    @Nested
    @DisplayName("getLevels()")
    class LevelTests {

        @Test
        @DisplayName("source filter keeps only that source's levels")
        void sourceFilter() {
            seedAlignedSpx();

            LevelListDTO levels = queryService.getLevels("SPX", "discord").block();

            assertEquals(SignalSource.DISCORD, levels.source());
            assertEquals(1, levels.count());
            assertEquals(5010.0, levels.levels().get(0).level().price());
        }

        @Test
        @DisplayName("unknown source id → IllegalArgumentException")
        void unknownSource() {
            StepVerifier.create(queryService.getLevels("SPX", "reddit"))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("dismissed level disappears from reads and from proximity")
        void dismissedExcluded() {
            seedAlignedSpx();
            long discordSupport = queryService.getLevels("SPX", "discord").block()
                .levels().get(0).level().id();

            fx.levelOverrideService.dismiss(discordSupport).block();

            SymbolDetailDTO detail = queryService.getSymbol("SPX").block();
            assertEquals(2, detail.levels().size());
            assertEquals(0.75, detail.confluence().score(), 1e-9);
        }
    }

    @Nested
    @DisplayName("opportunities() / refreshStaleness()")
    class CatalogSweepTests {

        @Test
        @DisplayName("only aligned symbols at or above the HIGH threshold are opportunities")
        void opportunities() {
            seedAlignedSpx();
            fx.ingestionService.ingestBatch(List.of(
                viewRecord("QQQ", SignalSource.KT_TECHNICAL, ViewBias.BULLISH, fx.clock.instant()),
                viewRecord("QQQ", SignalSource.DISCORD, ViewBias.BEARISH, fx.clock.instant()),
                viewRecord("BTC", SignalSource.TWITTER, ViewBias.BULLISH, fx.clock.instant())
            )).block();

            OpportunityListDTO result = queryService.opportunities().block();

            assertEquals(1, result.count());
            assertEquals(TrackedSymbol.SPX, result.opportunities().get(0).symbol());
            assertEquals(ViewBias.BULLISH, result.opportunities().get(0).biases().get("discord"));
            assertEquals(0.70, result.minScore(), 1e-9);
        }

        @Test
        @DisplayName("staleness report groups stale and expired views by source")
        void stalenessReport() {
            seedAlignedSpx();
            fx.clock.advance(Duration.ofDays(8));

            StalenessReportDTO report = queryService.refreshStaleness().block();

            assertEquals(TrackedSymbol.values().length, report.symbolsChecked());
            assertEquals(List.of("SPX"), report.expiredViews().get("discord"));
            assertEquals(List.of("SPX"), report.staleViews().get("kt_technical"));
            assertEquals(3, report.staleLevels());
            assertTrue(report.alignedSymbols().isEmpty());
        }
    }
}
