package com.kgbio.lookup.service;

import com.kgbio.lookup.config.WikidataProperties;
import com.kgbio.lookup.model.Candidate;
import com.kgbio.lookup.model.Identifier;
import com.kgbio.lookup.model.SparqlResult;
import com.kgbio.lookup.model.SparqlRow;
import com.kgbio.lookup.model.SparqlValue;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Hand-written stand-ins for the two HTTP clients, shared by the service tests.
 */
final class LookupStubs {
    private LookupStubs() {}

    static final String WD = "http://www.wikidata.org/entity/";

    static class StubSearch extends WikidataSearchClient {
        final Map<String, List<Candidate>> answers = new LinkedHashMap<>();
        final List<String> calls = Collections.synchronizedList(new ArrayList<>());

        StubSearch() { super(null, null, new WikidataProperties()); }

        StubSearch answer(String text, Identifier.Kind kind, String... ids) {
            List<Candidate> out = new ArrayList<>();
            for (String id : ids) out.add(new Candidate(new Identifier(kind, id), text, null));
            answers.put(kind + ":" + text, out);
            return this;
        }

        @Override
        public Mono<List<Candidate>> search(String text, Identifier.Kind kind, String language, int limit) {
            calls.add(kind + ":" + text);
            return Mono.just(answers.getOrDefault(kind + ":" + text, List.of()));
        }
    }

    static class StubExecutor extends SparqlQueryExecutor {
        final List<String> queries = Collections.synchronizedList(new ArrayList<>());
        private final Function<String, Mono<SparqlResult>> responder;

        StubExecutor(Function<String, Mono<SparqlResult>> responder) {
            super(null, null, new WikidataProperties());
            this.responder = responder;
        }

        @Override
        public Mono<SparqlResult> execute(String query) {
            return Mono.defer(() -> {
                queries.add(query);
                return responder.apply(query);
            });
        }
    }

    /** Row from alternating variable/value pairs; values starting with "http" are URIs. */
    static SparqlRow row(String... varsAndValues) {
        Map<String, SparqlValue> m = new LinkedHashMap<>();
        for (int i = 0; i < varsAndValues.length; i += 2) {
            String v = varsAndValues[i + 1];
            m.put(varsAndValues[i], v.startsWith("http") ? SparqlValue.uri(v) : SparqlValue.literal(v));
        }
        return new SparqlRow(m);
    }

    static SparqlResult result(SparqlRow... rows) {
        return new SparqlResult(List.of(), List.of(rows));
    }

    static PersonBioService bioService(SparqlQueryExecutor executor) {
        BioDeduplicator dedup = new BioDeduplicator();
        return new PersonBioService(new SparqlQueryBuilder(), executor, new BioResultParser(dedup), new BioAssembler(new RagTextRenderer()));
    }
}
