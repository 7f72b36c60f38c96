package com.kgbio.lookup.service;

import com.kgbio.lookup.exception.ValidationException;
import com.kgbio.lookup.model.Identifier;
import com.kgbio.lookup.model.ListKind;
import com.kgbio.lookup.model.TimelineKind;
import com.kgbio.lookup.model.YearFilter;
import com.kgbio.lookup.util.IdentifierValidator;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds SPARQL text for the statement lookup and for the three person queries.
 *
 * <p>All methods are pure functions of their arguments. Identifiers are already validated by
 * construction and the language tag is checked here, so nothing caller-supplied reaches the
 * query text unchecked.
 */
@Component
public class SparqlQueryBuilder {
    static final String START_TIME = "P580";
    static final String END_TIME = "P582";
    static final String POINT_IN_TIME = "P585";

    private static final String PREFIXES = """
            PREFIX wd: <http://www.wikidata.org/entity/>
            PREFIX wdt: <http://www.wikidata.org/prop/direct/>
            PREFIX p: <http://www.wikidata.org/prop/>
            PREFIX ps: <http://www.wikidata.org/prop/statement/>
            PREFIX pq: <http://www.wikidata.org/prop/qualifier/>
            PREFIX xsd: <http://www.w3.org/2001/XMLSchema#>
            PREFIX wikibase: <http://wikiba.se/ontology#>
            PREFIX bd: <http://www.bigdata.com/rdf#>
            """;

    /**
     * Value of {@code property} on {@code entity} for statements overlapping the year window.
     *
     * <p>A statement is kept when it has no start qualifier or starts on or before the window
     * end, and has no end qualifier or ends on or after the window start. Results are ordered by
     * start descending and limited to one row, so the most recent overlapping statement wins.
     */
    public String buildStatementQuery(Identifier entity, Identifier property, YearFilter year, String language) {
        requireKind(entity, Identifier.Kind.ENTITY);
        requireKind(property, Identifier.Kind.PROPERTY);
        String lang = labelLanguages(language);

        String yearStart;
        String yearEnd;
        if (year == null || year.isCurrent()) {
            yearStart = "xsd:dateTime(CONCAT(STR(YEAR(NOW())), \"-01-01T00:00:00Z\"))";
            yearEnd = "xsd:dateTime(CONCAT(STR(YEAR(NOW())), \"-12-31T23:59:59Z\"))";
        } else {
            int y = year.year().getAsInt();
            yearStart = "xsd:dateTime(\"" + y + "-01-01T00:00:00Z\")";
            yearEnd = "xsd:dateTime(\"" + y + "-12-31T23:59:59Z\")";
        }

        return PREFIXES + """

                SELECT ?value ?valueLabel ?start ?end WHERE {
                  wd:%1$s p:%2$s ?st .
                  ?st ps:%2$s ?value .

                  OPTIONAL { ?st pq:%3$s ?start . }
                  OPTIONAL { ?st pq:%4$s ?end . }

                  BIND(%5$s AS ?yearStart)
                  BIND(%6$s AS ?yearEnd)

                  FILTER(!BOUND(?start) || ?start <= ?yearEnd)
                  FILTER(!BOUND(?end)   || ?end   >= ?yearStart)

                  SERVICE wikibase:label { bd:serviceParam wikibase:language "%7$s". }
                }
                ORDER BY DESC(?start)
                LIMIT 1
                """.formatted(entity.value(), property.value(), START_TIME, END_TIME, yearStart, yearEnd, lang);
    }

    public String buildPersonCoreQuery(Identifier entity, String language) {
        requireKind(entity, Identifier.Kind.ENTITY);
        String lang = labelLanguages(language);
        return PREFIXES + """

                SELECT
                  ?item ?itemLabel ?itemDescription
                  ?dateOfBirth ?placeOfBirth ?placeOfBirthLabel
                  ?dateOfDeath ?placeOfDeath ?placeOfDeathLabel
                  ?givenName ?givenNameLabel
                  ?familyName ?familyNameLabel
                  ?nativeName
                  ?gender ?genderLabel
                  ?image
                WHERE {
                  BIND(wd:%1$s AS ?item)

                  OPTIONAL { ?item wdt:P569 ?dateOfBirth . }
                  OPTIONAL { ?item wdt:P19 ?placeOfBirth . }
                  OPTIONAL { ?item wdt:P570 ?dateOfDeath . }
                  OPTIONAL { ?item wdt:P20 ?placeOfDeath . }
                  OPTIONAL { ?item wdt:P735 ?givenName . }
                  OPTIONAL { ?item wdt:P734 ?familyName . }
                  OPTIONAL { ?item wdt:P1559 ?nativeName . }
                  OPTIONAL { ?item wdt:P21 ?gender . }
                  OPTIONAL { ?item wdt:P18 ?image . }

                  SERVICE wikibase:label { bd:serviceParam wikibase:language "%2$s". }
                }
                LIMIT 1
                """.formatted(entity.value(), lang);
    }

    /** Rows: {@code ?kind ?value ?valueLabel}, one UNION branch per {@link ListKind}. */
    public String buildPersonListsQuery(Identifier entity, String language) {
        requireKind(entity, Identifier.Kind.ENTITY);
        String lang = labelLanguages(language);
        String unions = Stream.of(ListKind.values())
                .map(kind -> """
                          {
                            BIND("%s" AS ?kind)
                            ?item wdt:%s ?value .
                          }
                        """.formatted(kind.key(), kind.property().value()))
                .collect(Collectors.joining("  UNION\n"));
        return PREFIXES + """

                SELECT ?kind ?value ?valueLabel WHERE {
                  BIND(wd:%1$s AS ?item)

                %2$s
                  SERVICE wikibase:label { bd:serviceParam wikibase:language "%3$s". }
                }
                """.formatted(entity.value(), unions, lang);
    }

    /**
     * Rows: {@code ?kind ?value ?valueLabel ?start ?end ?pointInTime}, one UNION branch per
     * {@link TimelineKind}. Inverse kinds match statements on {@code ?value} that point at the person.
     */
    public String buildPersonTimelineQuery(Identifier entity, String language) {
        requireKind(entity, Identifier.Kind.ENTITY);
        String lang = labelLanguages(language);
        String unions = Stream.of(TimelineKind.values())
                .map(SparqlQueryBuilder::timelineBranch)
                .collect(Collectors.joining("  UNION\n"));
        return PREFIXES + """

                SELECT ?kind ?value ?valueLabel ?start ?end ?pointInTime WHERE {
                  BIND(wd:%1$s AS ?item)

                %2$s
                  SERVICE wikibase:label { bd:serviceParam wikibase:language "%3$s". }
                }
                """.formatted(entity.value(), unions, lang);
    }

    private static String timelineBranch(TimelineKind kind) {
        String pid = kind.property().value();
        String subject = kind.isInverse() ? "?value" : "?item";
        String object = kind.isInverse() ? "?item" : "?value";
        return """
                  {
                    BIND("%1$s" AS ?kind)
                    %2$s p:%3$s ?stmt .
                    ?stmt ps:%3$s %4$s .
                    OPTIONAL { ?stmt pq:%5$s ?start . }
                    OPTIONAL { ?stmt pq:%6$s ?end . }
                    OPTIONAL { ?stmt pq:%7$s ?pointInTime . }
                  }
                """.formatted(kind.key(), subject, pid, object, START_TIME, END_TIME, POINT_IN_TIME);
    }

    /** Requested language first, English as fallback for missing labels. */
    static String labelLanguages(String language) {
        return IdentifierValidator.validateLanguage(language) + ",en";
    }

    private static void requireKind(Identifier id, Identifier.Kind kind) {
        if (id == null || id.kind() != kind) {
            throw new ValidationException("expected " + kind + " id, got " + id);
        }
    }
}
