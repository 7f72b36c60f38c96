package com.kgbio.lookup.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

@Configuration
public class WebClientConfig {
    public static final MediaType SPARQL_RESULTS_JSON = MediaType.parseMediaType("application/sparql-results+json");

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean(name = "wikidataSearchClient")
    public WebClient wikidataSearchClient(WikidataProperties props) {
        return WebClient.builder()
                .baseUrl(props.getSearchUrl())
                .exchangeStrategies(strategies(props))
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")))
                .build();
    }

    @Bean(name = "wikidataSparqlClient")
    public WebClient wikidataSparqlClient(WikidataProperties props) {
        return WebClient.builder()
                .baseUrl(props.getSparqlUrl())
                .exchangeStrategies(strategies(props))
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .defaultHeaders(headers -> headers.setAccept(List.of(SPARQL_RESULTS_JSON)))
                .build();
    }

    private static ExchangeStrategies strategies(WikidataProperties props) {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(props.getMaxInMemorySize()))
                .build();
    }
}
