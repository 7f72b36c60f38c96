package com.kgbio.lookup.service;

import com.kgbio.lookup.config.WikidataProperties;
import com.kgbio.lookup.exception.ResultParseException;
import com.kgbio.lookup.model.Identifier;
import com.kgbio.lookup.model.LookupOutcome;
import com.kgbio.lookup.model.LookupOutcome.NotFoundReason;
import com.kgbio.lookup.model.LookupRequest;
import com.kgbio.lookup.model.SparqlResult;
import com.kgbio.lookup.model.YearFilter;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Function;

import static com.kgbio.lookup.service.LookupStubs.WD;
import static com.kgbio.lookup.service.LookupStubs.result;
import static com.kgbio.lookup.service.LookupStubs.row;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the lookup chain over stubbed search and query clients.
 */
public class CoachLookupServiceTest {

    private final LookupStubs.StubSearch search = new LookupStubs.StubSearch();

    private CoachLookupService service(LookupStubs.StubExecutor executor) {
        return new CoachLookupService(
                new EntityResolver(search, new WikidataProperties()),
                new PropertyResolver(search, new WikidataProperties()),
                new SparqlQueryBuilder(), executor, LookupStubs.bioService(executor));
    }

    private static Function<String, Mono<SparqlResult>> statementThenPerson(SparqlResult statement) {
        return query -> query.contains("ORDER BY DESC(?start)")
                ? Mono.just(statement)
                : PersonBioServiceTest.personAnswers(query);
    }

    private static LookupRequest hertha(Integer year) {
        return new LookupRequest("Hertha BSC", "head coach", YearFilter.ofNullable(year), "en");
    }

    @Test
    public void unresolvedEntityIssuesNoQuery() {
        search.answer("head coach", Identifier.Kind.PROPERTY, "P286");
        LookupStubs.StubExecutor executor = new LookupStubs.StubExecutor(q -> Mono.error(new AssertionError("no query expected")));

        LookupOutcome outcome = service(executor).lookup(hertha(2021)).block(Duration.ofSeconds(5));

        assertFalse(outcome.isFound());
        assertEquals(NotFoundReason.ENTITY_NOT_FOUND, outcome.getReason());
        assertEquals(0, executor.queries.size());
    }

    @Test
    public void unresolvedPropertyIssuesNoQuery() {
        search.answer("Hertha BSC", Identifier.Kind.ENTITY, "Q2333");
        LookupStubs.StubExecutor executor = new LookupStubs.StubExecutor(q -> Mono.error(new AssertionError("no query expected")));

        LookupOutcome outcome = service(executor).lookup(hertha(null)).block(Duration.ofSeconds(5));

        assertEquals(NotFoundReason.PROPERTY_NOT_FOUND, outcome.getReason());
        assertTrue(executor.queries.isEmpty());
    }

    @Test
    public void noStatementRowIsNotFound() {
        search.answer("Hertha BSC", Identifier.Kind.ENTITY, "Q2333").answer("head coach", Identifier.Kind.PROPERTY, "P286");
        LookupStubs.StubExecutor executor = new LookupStubs.StubExecutor(statementThenPerson(result()));

        LookupOutcome outcome = service(executor).lookup(hertha(1890)).block(Duration.ofSeconds(5));

        assertEquals(NotFoundReason.NO_MATCHING_STATEMENT, outcome.getReason());
        assertEquals(1, executor.queries.size());
    }

    @Test
    public void literalValueStopsBeforeBiographyQueries() {
        search.answer("Hertha BSC", Identifier.Kind.ENTITY, "Q2333").answer("head coach", Identifier.Kind.PROPERTY, "P286");
        LookupStubs.StubExecutor executor = new LookupStubs.StubExecutor(
                statementThenPerson(result(row("value", "some literal coach name"))));

        LookupOutcome outcome = service(executor).lookup(hertha(2021)).block(Duration.ofSeconds(5));

        assertEquals(NotFoundReason.VALUE_NOT_AN_ENTITY, outcome.getReason());
        assertEquals(1, executor.queries.size(), "only the statement query ran");
    }

    @Test
    public void foundReturnsBioAndStatementRow() {
        search.answer("Hertha BSC", Identifier.Kind.ENTITY, "Q2333", "Q15812375")
                .answer("head coach", Identifier.Kind.PROPERTY, "P286");
        LookupStubs.StubExecutor executor = new LookupStubs.StubExecutor(statementThenPerson(result(
                row("value", WD + "Q1606", "valueLabel", "Pal Dardai", "start", "2021-01-25T00:00:00Z"))));

        LookupOutcome outcome = service(executor).lookup(hertha(2021)).block(Duration.ofSeconds(5));

        assertTrue(outcome.isFound());
        assertEquals(Identifier.entity("Q1606"), outcome.getBio().qid());
        assertEquals("Pal Dardai", outcome.getStatement().value("valueLabel"));
        assertEquals(4, executor.queries.size());
        assertTrue(executor.queries.get(0).contains("wd:Q2333 p:P286"));
        assertTrue(executor.queries.get(0).contains("2021-12-31T23:59:59Z"));
        assertTrue(executor.queries.subList(1, 4).stream().allMatch(q -> q.contains("wd:Q1606")));
    }

    @Test
    public void parseFailureOfStatementQueryPropagates() {
        search.answer("Hertha BSC", Identifier.Kind.ENTITY, "Q2333").answer("head coach", Identifier.Kind.PROPERTY, "P286");
        LookupStubs.StubExecutor executor = new LookupStubs.StubExecutor(q -> Mono.error(new ResultParseException("bad body")));

        assertThrows(ResultParseException.class, () -> service(executor).lookup(hertha(2021)).block(Duration.ofSeconds(5)));
    }

    @Test
    public void concurrentLookupsDoNotShareResolvedState() {
        search.answer("Hertha BSC", Identifier.Kind.ENTITY, "Q2333")
                .answer("Union Berlin", Identifier.Kind.ENTITY, "Q158")
                .answer("head coach", Identifier.Kind.PROPERTY, "P286");
        LookupStubs.StubExecutor executor = new LookupStubs.StubExecutor(statementThenPerson(result()));
        CoachLookupService svc = service(executor);

        Mono.zip(svc.lookup(hertha(2021)),
                        svc.lookup(new LookupRequest("Union Berlin", "head coach", YearFilter.of(2021), "en")))
                .block(Duration.ofSeconds(5));

        assertEquals(2, executor.queries.size());
        assertTrue(executor.queries.stream().anyMatch(q -> q.contains("wd:Q2333 ")));
        assertTrue(executor.queries.stream().anyMatch(q -> q.contains("wd:Q158 ")));
    }
}
