package com.kgbio.lookup.model;

/**
 * One ranked hit from the graph's text search.
 */
public record Candidate(Identifier id, String label, String description) {}
