package com.confluenceplatform.symbol.config;

import com.confluenceplatform.common.confluence.ConfluenceScorer;
import com.confluenceplatform.common.confluence.WeightedConfluenceScorer;
import com.confluenceplatform.common.level.LevelMerger;
import com.confluenceplatform.common.setup.TradeSetupSynthesizer;
import com.confluenceplatform.common.staleness.StalenessEvaluator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(ConfluenceProperties.class)
public class SymbolServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(SymbolServiceConfig.class);

    @Value("${services.extraction.base-url}")
    private String extractionUrl;

    @Value("${services.extraction.timeout-seconds:30}")
    private int extractionTimeoutSeconds;

    // ── engine components (pure, built from confluence.* properties) ──────

    @Bean
    public StalenessEvaluator stalenessEvaluator(ConfluenceProperties properties) {
        return properties.toStalenessEvaluator();
    }

    @Bean
    public LevelMerger levelMerger(ConfluenceProperties properties) {
        LevelMerger merger = properties.toLevelMerger();
        log.info("Level merger configured. tolerance={} lowConfidenceFloor={} policy={}",
                 merger.tolerance(), merger.lowConfidenceFloor(),
                 properties.getLevel().getMergeConfidencePolicy());
        return merger;
    }

    @Bean
    public ConfluenceScorer confluenceScorer(StalenessEvaluator stalenessEvaluator,
                                             ConfluenceProperties properties) {
        return new WeightedConfluenceScorer(stalenessEvaluator, properties.toWeights(),
                                            properties.getLevel().getMergeTolerance());
    }

    @Bean
    public TradeSetupSynthesizer tradeSetupSynthesizer(StalenessEvaluator stalenessEvaluator) {
        return new TradeSetupSynthesizer(stalenessEvaluator);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ── serialization ─────────────────────────────────────────────────────

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // ── Extraction Service client ─────────────────────────────────────────

    @Bean
    public WebClient extractionWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(extractionTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(extractionTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(extractionUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
