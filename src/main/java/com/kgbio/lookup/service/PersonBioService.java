package com.kgbio.lookup.service;

import com.kgbio.lookup.model.Bio;
import com.kgbio.lookup.model.CoreFacts;
import com.kgbio.lookup.model.Identifier;
import com.kgbio.lookup.model.ListsByKind;
import com.kgbio.lookup.model.TimelineByKind;
import com.kgbio.lookup.util.IdentifierValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Biography of one person: core, list and timeline queries run in parallel and are merged
 * only once all three succeeded.
 */
@Service
public class PersonBioService {
    private static final Logger log = LoggerFactory.getLogger(PersonBioService.class);

    private final SparqlQueryBuilder queryBuilder;
    private final SparqlQueryExecutor executor;
    private final BioResultParser parser;
    private final BioAssembler assembler;

    public PersonBioService(SparqlQueryBuilder queryBuilder, SparqlQueryExecutor executor, BioResultParser parser, BioAssembler assembler) {
        this.queryBuilder = queryBuilder;
        this.executor = executor;
        this.parser = parser;
        this.assembler = assembler;
    }

    /** Accepts {@code Q42} as well as bare digits such as {@code 42}. */
    public Mono<Bio> fetchBio(String rawQid, String language) {
        return Mono.fromCallable(() -> IdentifierValidator.normalizeEntity(rawQid))
                .flatMap(qid -> fetchBio(qid, language));
    }

    /**
     * Fails as a whole when any of the three queries fails; the zip cancels the remaining ones,
     * so a partial biography is never assembled.
     */
    public Mono<Bio> fetchBio(Identifier qid, String language) {
        return Mono.defer(() -> {
            String coreQuery = queryBuilder.buildPersonCoreQuery(qid, language);
            String listsQuery = queryBuilder.buildPersonListsQuery(qid, language);
            String timelineQuery = queryBuilder.buildPersonTimelineQuery(qid, language);

            Mono<CoreFacts> core = executor.execute(coreQuery).map(parser::parseCore);
            Mono<ListsByKind> lists = executor.execute(listsQuery).map(parser::parseLists);
            Mono<TimelineByKind> timeline = executor.execute(timelineQuery).map(parser::parseTimeline);

            return Mono.zip(core, lists, timeline)
                    .map(parts -> assembler.assemble(qid, parts.getT1(), parts.getT2(), parts.getT3()))
                    .doOnNext(bio -> log.info("Assembled bio for {} ({}): {} list kinds, {} timeline kinds",
                            bio.qid(), bio.label(), bio.lists().asMap().size(), bio.timeline().asMap().size()))
                    .doOnError(e -> log.warn("Bio fetch for {} failed: {}", qid, e.toString()));
        });
    }
}
