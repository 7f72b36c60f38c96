package com.kgbio.lookup.service;

import com.kgbio.lookup.model.Identifier;
import com.kgbio.lookup.model.LookupOutcome;
import com.kgbio.lookup.model.LookupOutcome.NotFoundReason;
import com.kgbio.lookup.model.LookupRequest;
import com.kgbio.lookup.model.ResolvedLookup;
import com.kgbio.lookup.model.SparqlRow;
import com.kgbio.lookup.util.EntityUris;
import com.kgbio.lookup.util.IdentifierValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * "Who held property P of entity E around year Y", followed by that person's biography.
 *
 * <p>Steps run in a fixed order: resolve both texts, run the statement query, take the QID of the
 * matched value, fetch the biography. Each soft miss ends the lookup with a not-found outcome;
 * transport and parse failures are propagated unchanged.
 */
@Service
public class CoachLookupService {
    private static final Logger log = LoggerFactory.getLogger(CoachLookupService.class);

    private final EntityResolver entityResolver;
    private final PropertyResolver propertyResolver;
    private final SparqlQueryBuilder queryBuilder;
    private final SparqlQueryExecutor executor;
    private final PersonBioService personBioService;

    public CoachLookupService(EntityResolver entityResolver, PropertyResolver propertyResolver, SparqlQueryBuilder queryBuilder,
                              SparqlQueryExecutor executor, PersonBioService personBioService) {
        this.entityResolver = entityResolver;
        this.propertyResolver = propertyResolver;
        this.queryBuilder = queryBuilder;
        this.executor = executor;
        this.personBioService = personBioService;
    }

    public Mono<LookupOutcome> lookup(LookupRequest request) {
        return Mono.defer(() -> {
            String language = IdentifierValidator.validateLanguage(request.language());
            return Mono.zip(
                            entityResolver.resolve(request.entityText(), language),
                            propertyResolver.resolve(request.propertyText(), language))
                    .flatMap(ids -> {
                        if (ids.getT1().isEmpty()) {
                            return notFound(request, NotFoundReason.ENTITY_NOT_FOUND);
                        }
                        if (ids.getT2().isEmpty()) {
                            return notFound(request, NotFoundReason.PROPERTY_NOT_FOUND);
                        }
                        return lookupResolved(new ResolvedLookup(ids.getT1().get(), ids.getT2().get(), request.year(), language));
                    });
        });
    }

    /** Lookup for already resolved identifiers; starts at the statement query. */
    public Mono<LookupOutcome> lookupResolved(ResolvedLookup resolved) {
        return Mono.defer(() -> {
            String query = queryBuilder.buildStatementQuery(resolved.entity(), resolved.property(), resolved.year(), resolved.language());
            return executor.execute(query).flatMap(result -> {
                if (result.isEmpty()) {
                    log.info("No statement for {} {} in year {}", resolved.entity(), resolved.property(), resolved.year());
                    return Mono.just(LookupOutcome.notFound(NotFoundReason.NO_MATCHING_STATEMENT));
                }
                SparqlRow statement = result.rows().get(0);
                Identifier subject = EntityUris.qidFromUri(statement.value("value"));
                if (subject == null) {
                    log.info("Statement value '{}' for {} {} is not an entity", statement.value("value"), resolved.entity(), resolved.property());
                    return Mono.just(LookupOutcome.notFound(NotFoundReason.VALUE_NOT_AN_ENTITY));
                }
                log.debug("{} {} ({}) -> {}", resolved.entity(), resolved.property(), resolved.year(), subject);
                return personBioService.fetchBio(subject, resolved.language())
                        .map(bio -> LookupOutcome.found(bio, statement));
            });
        });
    }

    private static Mono<LookupOutcome> notFound(LookupRequest request, NotFoundReason reason) {
        log.info("Lookup entity='{}' property='{}' ended: {}", request.entityText(), request.propertyText(), reason.key());
        return Mono.just(LookupOutcome.notFound(reason));
    }
}
