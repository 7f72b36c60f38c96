package com.kgbio.lookup.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kgbio.lookup.config.WikidataProperties;
import com.kgbio.lookup.exception.UpstreamException;
import com.kgbio.lookup.model.Candidate;
import com.kgbio.lookup.model.Identifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Text search over items and properties using the action API's wbsearchentities module.
 * An empty match set is a normal answer; transport problems surface as {@link UpstreamException}.
 */
@Service
public class WikidataSearchClient {
    private static final Logger log = LoggerFactory.getLogger(WikidataSearchClient.class);

    private final WebClient http;
    private final ObjectMapper objectMapper;
    private final WikidataProperties props;

    public WikidataSearchClient(@Qualifier("wikidataSearchClient") WebClient http, ObjectMapper objectMapper, WikidataProperties props) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public Mono<List<Candidate>> search(String text, Identifier.Kind kind, String language, int limit) {
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .queryParam("action", "wbsearchentities")
                        .queryParam("format", "json")
                        .queryParam("search", "{text}")
                        .queryParam("language", "{language}")
                        .queryParam("languagefallback", 1)
                        .queryParam("limit", Math.max(1, limit))
                        .queryParam("type", kind.searchType())
                        .build(text, language))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> {
                            log.warn("Search failed: status={} text='{}' body={}", resp.statusCode().value(), text, abbreviate(body));
                            return new UpstreamException("search endpoint returned " + resp.statusCode().value(), resp.statusCode().value());
                        }))
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(Duration.ofMillis(props.getTimeoutMs()))
                .onErrorMap(TimeoutException.class, e -> new UpstreamException("search endpoint timed out after " + props.getTimeoutMs() + " ms", e))
                .onErrorMap(WebClientRequestException.class, e -> new UpstreamException("search endpoint unreachable: " + e.getMessage(), e))
                .onErrorMap(WebClientException.class, e -> new UpstreamException("search endpoint transport failure: " + e.getMessage(), e))
                .map(body -> toCandidates(body, kind, text));
    }

    private List<Candidate> toCandidates(String body, Identifier.Kind kind, String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("search endpoint returned a malformed body", e);
        }
        if (root == null || !root.isObject()) {
            throw new UpstreamException("search endpoint returned a malformed body", -1);
        }
        if (root.has("error")) {
            JsonNode err = root.get("error");
            throw new UpstreamException("search endpoint error: " + err.path("code").asText("") + " " + err.path("info").asText(""), -1);
        }
        JsonNode hits = root.path("search");
        List<Candidate> out = new ArrayList<>();
        if (!hits.isArray()) {
            log.info("No {} candidates for '{}'", kind, text);
            return out;
        }
        for (JsonNode hit : hits) {
            String id = hit.path("id").asText(null);
            if (!kind.matches(id)) {
                log.warn("Skipping {} candidate with unexpected id '{}' for '{}'", kind, id, text);
                continue;
            }
            out.add(new Candidate(new Identifier(kind, id), textOrNull(hit, "label"), textOrNull(hit, "description")));
        }
        log.debug("Search '{}' ({}) -> {} candidates", text, kind, out.size());
        return out;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }
}
