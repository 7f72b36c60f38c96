package com.kgbio.lookup.service;

import com.kgbio.lookup.config.WikidataProperties;
import com.kgbio.lookup.model.Candidate;
import com.kgbio.lookup.model.Identifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Turns free text into the top-ranked identifier of one kind. No match is an expected outcome
 * and yields an empty Optional, never an error.
 */
public abstract class CandidateResolver {
    private static final Logger log = LoggerFactory.getLogger(CandidateResolver.class);

    private final WikidataSearchClient searchClient;
    private final WikidataProperties props;
    private final Identifier.Kind kind;

    protected CandidateResolver(WikidataSearchClient searchClient, WikidataProperties props, Identifier.Kind kind) {
        this.searchClient = searchClient;
        this.props = props;
        this.kind = kind;
    }

    public Mono<Optional<Identifier>> resolve(String text, String language) {
        if (text == null || text.isBlank()) {
            return Mono.just(Optional.empty());
        }
        String query = text.trim();
        return searchClient.search(query, kind, language, props.getSearchLimit())
                .map(candidates -> pickTop(query, candidates));
    }

    private Optional<Identifier> pickTop(String text, List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            log.warn("Could not find the {} '{}'", kind, text);
            return Optional.empty();
        }
        Candidate top = candidates.get(0);
        log.debug("Resolved {} '{}' -> {} ({})", kind, text, top.id(), top.label());
        return Optional.of(top.id());
    }
}
