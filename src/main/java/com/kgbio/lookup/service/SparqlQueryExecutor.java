package com.kgbio.lookup.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kgbio.lookup.config.WebClientConfig;
import com.kgbio.lookup.config.WikidataProperties;
import com.kgbio.lookup.exception.ResultParseException;
import com.kgbio.lookup.exception.UpstreamException;
import com.kgbio.lookup.model.SparqlResult;
import com.kgbio.lookup.model.SparqlRow;
import com.kgbio.lookup.model.SparqlValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs query text against the SPARQL endpoint. One POST per call, no retry; callers own retry policy.
 */
@Service
public class SparqlQueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(SparqlQueryExecutor.class);

    private final WebClient http;
    private final ObjectMapper objectMapper;
    private final WikidataProperties props;

    public SparqlQueryExecutor(@Qualifier("wikidataSparqlClient") WebClient http, ObjectMapper objectMapper, WikidataProperties props) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public Mono<SparqlResult> execute(String query) {
        return Mono.defer(() -> {
            log.debug("SPARQL query:\n{}", query);
            return http.post()
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(WebClientConfig.SPARQL_RESULTS_JSON)
                    .body(BodyInserters.fromFormData("query", query))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> {
                                log.warn("Query service error: status={}\nQuery:\n{}\nResponse:\n{}",
                                        resp.statusCode().value(), query, WikidataSearchClient.abbreviate(body));
                                return new UpstreamException("query service returned " + resp.statusCode().value(), resp.statusCode().value());
                            }))
                    .bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .timeout(Duration.ofMillis(props.getTimeoutMs()))
                    .onErrorMap(TimeoutException.class, e -> new UpstreamException("query service timed out after " + props.getTimeoutMs() + " ms", e))
                    .onErrorMap(WebClientRequestException.class, e -> new UpstreamException("query service unreachable: " + e.getMessage(), e))
                    .onErrorMap(WebClientException.class, e -> new UpstreamException("query service transport failure: " + e.getMessage(), e))
                    .map(this::parseResults);
        });
    }

    /**
     * Reads a SPARQL 1.1 JSON results document. Only {@code results.bindings} is required;
     * each binding must be an object whose values carry a textual {@code value}.
     */
    SparqlResult parseResults(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ResultParseException("query service returned a body that is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ResultParseException("query service returned an empty or non-object body");
        }
        JsonNode bindings = root.path("results").path("bindings");
        if (!bindings.isArray()) {
            throw new ResultParseException("query service response has no results.bindings array");
        }
        List<String> vars = new ArrayList<>();
        for (JsonNode v : root.path("head").path("vars")) {
            vars.add(v.asText());
        }
        List<SparqlRow> rows = new ArrayList<>(bindings.size());
        for (JsonNode binding : bindings) {
            rows.add(toRow(binding));
        }
        return new SparqlResult(vars, rows);
    }

    private static SparqlRow toRow(JsonNode binding) {
        if (!binding.isObject()) {
            throw new ResultParseException("binding is not an object: " + binding);
        }
        Map<String, SparqlValue> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = binding.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            JsonNode value = node.get("value");
            if (!node.isObject() || value == null || !value.isValueNode()) {
                throw new ResultParseException("variable '" + field.getKey() + "' has no value");
            }
            values.put(field.getKey(), new SparqlValue(
                    textOrNull(node, "type"), value.asText(), textOrNull(node, "datatype"), textOrNull(node, "xml:lang")));
        }
        return new SparqlRow(values);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
