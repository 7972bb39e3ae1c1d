package com.handcoach.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.handcoach.common.equity.EquityEstimator;
import com.handcoach.common.equity.ExhaustiveEquityCalculator;
import com.handcoach.common.range.PreflopRangeTable;
import com.handcoach.common.range.RangeEngine;
import com.handcoach.common.range.StreetRangeBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class CoachConfig {

    @Value("${coach.narrative.base-url}")
    private String narrativeBaseUrl;

    @Value("${coach.narrative.api-version:2023-06-01}")
    private String narrativeApiVersion;

    @Value("${coach.ranges.resource:" + PreflopRangeTable.DEFAULT_RESOURCE + "}")
    private String rangesResource;

    @Bean
    public WebClient narrativeWebClient(WebClient.Builder builder) {
        return builder
            .baseUrl(narrativeBaseUrl)
            .defaultHeader("anthropic-version", narrativeApiVersion)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    /** Loaded once at startup; a missing or malformed table fails the boot. */
    @Bean
    public PreflopRangeTable preflopRangeTable(ObjectMapper objectMapper) {
        return PreflopRangeTable.fromClasspath(objectMapper, rangesResource);
    }

    @Bean
    public RangeEngine rangeEngine(PreflopRangeTable preflopRangeTable) {
        return new RangeEngine(preflopRangeTable);
    }

    @Bean
    public StreetRangeBuilder streetRangeBuilder(RangeEngine rangeEngine) {
        return new StreetRangeBuilder(rangeEngine);
    }

    @Bean
    public EquityEstimator equityEstimator() {
        return new EquityEstimator(new ExhaustiveEquityCalculator());
    }
}
