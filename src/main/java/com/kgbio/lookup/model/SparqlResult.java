package com.kgbio.lookup.model;

import java.util.List;

/**
 * Rows of one query execution, in the order the service returned them.
 */
public record SparqlResult(List<String> vars, List<SparqlRow> rows) {

    public SparqlResult {
        vars = vars == null ? List.of() : List.copyOf(vars);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public boolean isEmpty() { return rows.isEmpty(); }
}
