package com.confluenceplatform.symbol.service;

import com.confluenceplatform.common.event.ExtractionRecord;
import com.confluenceplatform.common.event.RecordKind;
import com.confluenceplatform.common.model.LevelType;
import com.confluenceplatform.common.model.PriceLevel;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.SourceView;
import com.confluenceplatform.common.model.TrackedSymbol;
import com.confluenceplatform.common.model.ViewBias;
import com.confluenceplatform.symbol.dto.BatchIngestResultDTO;
import com.confluenceplatform.symbol.dto.IngestResultDTO;
import com.confluenceplatform.symbol.support.SymbolServiceFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static com.confluenceplatform.symbol.support.SymbolServiceFixture.T0;
import static com.confluenceplatform.symbol.support.SymbolServiceFixture.levelRecord;
import static com.confluenceplatform.symbol.support.SymbolServiceFixture.viewRecord;
import static org.junit.jupiter.api.Assertions.*;

class IngestionServiceTest {

    private final SymbolServiceFixture fx = new SymbolServiceFixture();
    private final IngestionService service = fx.ingestionService;

    @Nested
    @DisplayName("level records")
    class LevelTests {

        @Test
        @DisplayName("first observation inserted, replay leaves the store unchanged")
        void replayIsIdempotent() {
            ExtractionRecord record = levelRecord("/ES", SignalSource.KT_TECHNICAL, LevelType.SUPPORT, 5000, 0.8, T0);

            IngestResultDTO first = service.ingest(record).block();
            List<PriceLevel> afterFirst = fx.levelStore.levelsFor(TrackedSymbol.SPX);
            IngestResultDTO second = service.ingest(record).block();

            assertEquals(IngestOutcome.LEVEL_INSERTED, first.outcome());
            assertEquals(TrackedSymbol.SPX, first.symbol());
            assertEquals(IngestOutcome.LEVEL_MERGED, second.outcome());
            assertEquals(first.levelId(), second.levelId());
            assertEquals(afterFirst, fx.levelStore.levelsFor(TrackedSymbol.SPX));
        }

        @Test
        @DisplayName("observation older than the stored level → STALE_WRITE_IGNORED")
        void olderLevelIgnored() {
            service.ingest(levelRecord("SPX", SignalSource.DISCORD, LevelType.TARGET, 5200, 0.8, T0)).block();

            IngestResultDTO result = service.ingest(levelRecord("SPX", SignalSource.DISCORD, LevelType.TARGET,
                                                                5210, 0.9, T0.minus(Duration.ofHours(3)))).block();

            assertEquals(IngestOutcome.STALE_WRITE_IGNORED, result.outcome());
            assertEquals(5200.0, fx.confluenceService.snapshot(TrackedSymbol.SPX).activeLevels().get(0).price());
        }
    }

    @Nested
    @DisplayName("view records")
    class ViewTests {

        @Test
        @DisplayName("newer snapshot replaces, older one is a stale write")
        void viewUpsert() {
            StepVerifier.create(service.ingest(viewRecord("QQQ", SignalSource.DISCORD, ViewBias.BULLISH, T0)))
                .assertNext(r -> assertEquals(IngestOutcome.VIEW_UPDATED, r.outcome()))
                .verifyComplete();

            StepVerifier.create(service.ingest(viewRecord("QQQ", SignalSource.DISCORD, ViewBias.BEARISH,
                                                          T0.minus(Duration.ofHours(1)))))
                .assertNext(r -> assertEquals(IngestOutcome.STALE_WRITE_IGNORED, r.outcome()))
                .verifyComplete();

            StepVerifier.create(service.ingest(viewRecord("QQQ", SignalSource.DISCORD, ViewBias.BEARISH,
                                                          T0.plus(Duration.ofHours(1)))))
                .assertNext(r -> assertEquals(IngestOutcome.VIEW_UPDATED, r.outcome()))
                .verifyComplete();

            List<SourceView> views = fx.viewStore.viewsFor(TrackedSymbol.QQQ);
            assertEquals(1, views.size());
            assertEquals(ViewBias.BEARISH, views.get(0).bias());
        }
    }

    @Nested
    @DisplayName("rejections")
    class RejectionTests {

        @Test
        @DisplayName("untracked symbol → REJECTED with reason, nothing stored")
        void untrackedSymbol() {
            IngestResultDTO result = service.ingest(
                levelRecord("/GC", SignalSource.DISCORD, LevelType.SUPPORT, 2000, 0.8, T0)).block();

            assertEquals(IngestOutcome.REJECTED, result.outcome());
            assertEquals("symbol '/GC' is not tracked", result.reason());
            assertNull(result.symbol());
        }

        @Test
        @DisplayName("missing kind → REJECTED")
        void missingKind() {
            ExtractionRecord record = new ExtractionRecord("SPX", SignalSource.DISCORD, null,
                                                           null, null, "c-1", T0);

            assertEquals(IngestOutcome.REJECTED, service.ingest(record).block().outcome());
        }

        @Test
        @DisplayName("a bad record does not abort the batch")
        void batchContinuesPastRejection() {
            List<ExtractionRecord> batch = Arrays.asList(
                levelRecord("NVDA", SignalSource.YOUTUBE, LevelType.RESISTANCE, 950, 0.8, T0),
                levelRecord("/CL", SignalSource.YOUTUBE, LevelType.SUPPORT, 80, 0.8, T0),
                null,
                viewRecord("NVIDIA", SignalSource.YOUTUBE, ViewBias.BULLISH, T0),
                new ExtractionRecord("NVDA", SignalSource.YOUTUBE, RecordKind.LEVEL, null, null, "c-2", T0));

            BatchIngestResultDTO result = service.ingestBatch(batch).block();

            assertEquals(5, result.received());
            assertEquals(1, result.counts().get(IngestOutcome.LEVEL_INSERTED));
            assertEquals(1, result.counts().get(IngestOutcome.VIEW_UPDATED));
            assertEquals(3, result.counts().get(IngestOutcome.REJECTED));
            assertEquals(0, result.counts().get(IngestOutcome.LEVEL_MERGED));
            assertEquals(3, result.rejections().size());
            assertEquals(1, fx.confluenceService.snapshot(TrackedSymbol.NVDA).activeLevels().size());
        }
    }
}
