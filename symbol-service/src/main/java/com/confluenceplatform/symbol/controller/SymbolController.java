package com.confluenceplatform.symbol.controller;

import com.confluenceplatform.common.event.ExtractionRecord;
import com.confluenceplatform.common.exception.SymbolNotFoundException;
import com.confluenceplatform.symbol.dto.BatchIngestResultDTO;
import com.confluenceplatform.symbol.dto.ErrorResponseDTO;
import com.confluenceplatform.symbol.dto.IngestResultDTO;
import com.confluenceplatform.symbol.dto.LevelListDTO;
import com.confluenceplatform.symbol.dto.LevelUpdateRequest;
import com.confluenceplatform.symbol.dto.LevelUpdateResultDTO;
import com.confluenceplatform.symbol.dto.OpportunityListDTO;
import com.confluenceplatform.symbol.dto.StalenessReportDTO;
import com.confluenceplatform.symbol.dto.SymbolDetailDTO;
import com.confluenceplatform.symbol.dto.SymbolListDTO;
import com.confluenceplatform.symbol.exception.ExtractionServiceException;
import com.confluenceplatform.symbol.exception.LevelNotFoundException;
import com.confluenceplatform.symbol.service.ContentExtractionService;
import com.confluenceplatform.symbol.service.IngestionService;
import com.confluenceplatform.symbol.service.LevelOverrideService;
import com.confluenceplatform.symbol.service.SymbolQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/symbols")
public class SymbolController {

    private static final Logger log = LoggerFactory.getLogger(SymbolController.class);

    private final SymbolQueryService queryService;
    private final IngestionService ingestionService;
    private final LevelOverrideService levelOverrideService;
    private final ContentExtractionService extractionService;

    public SymbolController(SymbolQueryService queryService,
                            IngestionService ingestionService,
                            LevelOverrideService levelOverrideService,
                            ContentExtractionService extractionService) {
        this.queryService         = queryService;
        this.ingestionService     = ingestionService;
        this.levelOverrideService = levelOverrideService;
        this.extractionService    = extractionService;
    }

    // ── reads ─────────────────────────────────────────────────────────────

    @GetMapping
    public Mono<ResponseEntity<SymbolListDTO>> listSymbols() {
        log.info("Symbol list query received");
        return queryService.listSymbols()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Symbol list endpoint error", e));
    }

    @GetMapping("/{symbol}")
    public Mono<ResponseEntity<SymbolDetailDTO>> getSymbol(@PathVariable String symbol) {
        log.info("Symbol detail query received. symbol={}", symbol);
        return queryService.getSymbol(symbol)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{symbol}/levels")
    public Mono<ResponseEntity<LevelListDTO>> getLevels(@PathVariable String symbol,
                                                        @RequestParam(required = false) String source) {
        log.info("Level query received. symbol={} source={}", symbol, source);
        return queryService.getLevels(symbol, source)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/confluence/opportunities")
    public Mono<ResponseEntity<OpportunityListDTO>> opportunities() {
        log.info("Confluence opportunities query received");
        return queryService.opportunities()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Opportunities endpoint error", e));
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<StalenessReportDTO>> refresh() {
        log.info("Staleness refresh requested");
        return queryService.refreshStaleness()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Staleness refresh endpoint error", e));
    }

    @GetMapping("/health")
    public Mono<String> health() {
        return Mono.just("OK");
    }

    // ── ingestion ─────────────────────────────────────────────────────────

    @PostMapping("/ingest")
    public Mono<ResponseEntity<IngestResultDTO>> ingest(@RequestBody ExtractionRecord record) {
        log.info("Ingest request received. contentId={} source={} kind={}",
                 record.contentId(), record.source(), record.kind());
        return ingestionService.ingest(record)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Ingest endpoint error. contentId={}", record.contentId(), e));
    }

    @PostMapping("/ingest/batch")
    public Mono<ResponseEntity<BatchIngestResultDTO>> ingestBatch(@RequestBody List<ExtractionRecord> records) {
        log.info("Batch ingest request received. records={}", records.size());
        return ingestionService.ingestBatch(records)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Batch ingest endpoint error", e));
    }

    @PostMapping("/extract/{contentId}")
    public Mono<ResponseEntity<BatchIngestResultDTO>> extract(@PathVariable String contentId,
                                                              @RequestParam(required = false) String source) {
        log.info("Extraction requested. contentId={} source={}", contentId, source);
        return extractionService.extractAndIngest(contentId, source)
            .map(ResponseEntity::ok);
    }

    // ── user overrides ────────────────────────────────────────────────────

    @PatchMapping("/levels/{levelId}")
    public Mono<ResponseEntity<LevelUpdateResultDTO>> updateLevel(@PathVariable long levelId,
                                                                  @RequestBody LevelUpdateRequest request) {
        log.info("Level update received. levelId={}", levelId);
        return levelOverrideService.update(levelId, request)
            .map(ResponseEntity::ok);
    }

    @DeleteMapping("/levels/{levelId}")
    public Mono<ResponseEntity<LevelUpdateResultDTO>> dismissLevel(@PathVariable long levelId) {
        log.info("Level dismiss received. levelId={}", levelId);
        return levelOverrideService.dismiss(levelId)
            .map(ResponseEntity::ok);
    }

    // ── error mapping ─────────────────────────────────────────────────────

    @ExceptionHandler(SymbolNotFoundException.class)
    public ResponseEntity<ErrorResponseDTO> symbolNotFound(SymbolNotFoundException e) {
        log.warn("Symbol not found. symbol={}", e.getSymbol());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ErrorResponseDTO.symbolNotFound(e.getSymbol(), e.getMessage()));
    }

    @ExceptionHandler(LevelNotFoundException.class)
    public ResponseEntity<ErrorResponseDTO> levelNotFound(LevelNotFoundException e) {
        log.warn("Level not found. levelId={}", e.getLevelId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ErrorResponseDTO.levelNotFound(e.getLevelId(), e.getMessage()));
    }

    @ExceptionHandler(ExtractionServiceException.class)
    public ResponseEntity<ErrorResponseDTO> extractionFailed(ExtractionServiceException e) {
        log.error("Extraction Service failure. contentId={}", e.getContentId(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(ErrorResponseDTO.extractionFailed(e.getContentId(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDTO> badRequest(IllegalArgumentException e) {
        log.warn("Bad request. message={}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponseDTO.badRequest(e.getMessage()));
    }
}
