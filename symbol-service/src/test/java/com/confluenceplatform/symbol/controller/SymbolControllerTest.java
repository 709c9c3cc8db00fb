package com.confluenceplatform.symbol.controller;

import com.confluenceplatform.common.model.LevelType;
import com.confluenceplatform.common.model.SignalSource;
import com.confluenceplatform.common.model.ViewBias;
import com.confluenceplatform.symbol.client.ExtractionServiceClient;
import com.confluenceplatform.symbol.exception.ExtractionServiceException;
import com.confluenceplatform.symbol.support.SymbolServiceFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.confluenceplatform.symbol.support.SymbolServiceFixture.T0;
import static com.confluenceplatform.symbol.support.SymbolServiceFixture.levelRecord;
import static com.confluenceplatform.symbol.support.SymbolServiceFixture.viewRecord;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SymbolControllerTest {

    private SymbolServiceFixture fx;
    private ExtractionServiceClient extractionClient;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        fx = new SymbolServiceFixture();
        extractionClient = mock(ExtractionServiceClient.class);
        SymbolController controller = new SymbolController(
            fx.queryService, fx.ingestionService, fx.levelOverrideService,
            fx.extractionService(extractionClient));
        client = WebTestClient.bindToController(controller).build();
    }

    @Nested
    @DisplayName("reads")
    class ReadTests {

        @Test
        @DisplayName("GET /health → OK")
        void health() {
            client.get().uri("/api/v1/symbols/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("OK");
        }

        @Test
        @DisplayName("GET /{symbol} for an untracked symbol → 404 SYMBOL_NOT_FOUND")
        void unknownSymbol() {
            client.get().uri("/api/v1/symbols/XYZ")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("SYMBOL_NOT_FOUND")
                .jsonPath("$.symbol").isEqualTo("XYZ")
                .jsonPath("$.message").exists();
        }

        @Test
        @DisplayName("GET /{symbol} resolves aliases and returns the confluence picture")
        void detailByAlias() {
            fx.ingestionService.ingestBatch(List.of(
                viewRecord("QQQ", SignalSource.KT_TECHNICAL, ViewBias.BULLISH, T0),
                viewRecord("QQQ", SignalSource.MACRO42, ViewBias.BULLISH, T0))).block();

            client.get().uri("/api/v1/symbols/NQ=F")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.symbol").isEqualTo("QQQ")
                .jsonPath("$.views.kt_technical.view.bias").isEqualTo("bullish")
                .jsonPath("$.confluence.classification").isEqualTo("high")
                .jsonPath("$.confluence.aligned").isEqualTo(true);
        }

        @Test
        @DisplayName("GET / lists the whole catalog")
        void listAll() {
            client.get().uri("/api/v1/symbols")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(11)
                .jsonPath("$.symbols[0].symbol").isEqualTo("SPX");
        }

        @Test
        @DisplayName("GET /{symbol}/levels with an unknown source → 400")
        void unknownSourceFilter() {
            client.get().uri("/api/v1/symbols/SPX/levels?source=reddit")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("BAD_REQUEST");
        }
    }

    @Nested
    @DisplayName("ingestion")
    class IngestTests {

        @Test
        @DisplayName("POST /ingest stores a level")
        void ingestLevel() {
            client.post().uri("/api/v1/symbols/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"symbolText":"/ES","source":"kt_technical","kind":"level","contentId":"kt-1",
                     "observedAt":"2024-03-01T14:00:00Z",
                     "level":{"type":"support","price":5000,"confidence":0.85}}
                    """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.outcome").isEqualTo("LEVEL_INSERTED")
                .jsonPath("$.symbol").isEqualTo("SPX")
                .jsonPath("$.levelId").exists();
        }

        @Test
        @DisplayName("POST /ingest with an untracked symbol → 200 REJECTED with reason")
        void ingestRejected() {
            client.post().uri("/api/v1/symbols/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"symbolText":"/CL","source":"discord","kind":"level","contentId":"d-9",
                     "observedAt":"2024-03-01T14:00:00Z","level":{"type":"support","price":80}}
                    """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.outcome").isEqualTo("REJECTED")
                .jsonPath("$.reason").isEqualTo("symbol '/CL' is not tracked");
        }

        @Test
        @DisplayName("POST /extract/{contentId} with an Extraction Service failure → 502")
        void extractionFailure() {
            when(extractionClient.extract(any(), any())).thenReturn(Mono.error(
                new ExtractionServiceException("sub-1", "Extraction Service call failed", null)));

            client.post().uri("/api/v1/symbols/extract/sub-1?source=substack")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("EXTRACTION_FAILED")
                .jsonPath("$.contentId").isEqualTo("sub-1");
        }
    }

    @Nested
    @DisplayName("level overrides")
    class OverrideTests {

        @Test
        @DisplayName("PATCH unknown level → 404 LEVEL_NOT_FOUND")
        void patchUnknown() {
            client.patch().uri("/api/v1/symbols/levels/12345")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"price\": 5100}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("LEVEL_NOT_FOUND")
                .jsonPath("$.levelId").isEqualTo(12345);
        }

        @Test
        @DisplayName("PATCH edits the price; DELETE dismisses the level")
        void patchThenDismiss() {
            long id = fx.ingestionService.ingest(
                levelRecord("SMH", SignalSource.MACRO42, LevelType.RESISTANCE, 250, 0.8, T0)).block().levelId();

            client.patch().uri("/api/v1/symbols/levels/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"price\": 252.5}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.level.price").isEqualTo(252.5)
                .jsonPath("$.level.active").isEqualTo(true);

            client.delete().uri("/api/v1/symbols/levels/" + id)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.level.active").isEqualTo(false)
                .jsonPath("$.level.inactiveReason").isEqualTo("dismissed");
        }

        @Test
        @DisplayName("PATCH with a non-positive price → 400")
        void patchInvalidPrice() {
            long id = fx.ingestionService.ingest(
                levelRecord("SMH", SignalSource.MACRO42, LevelType.RESISTANCE, 250, 0.8, T0)).block().levelId();

            client.patch().uri("/api/v1/symbols/levels/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"price\": -1}")
                .exchange()
                .expectStatus().isBadRequest();
        }
    }
}
