package com.kgbio.lookup.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Upstream endpoints and transport settings.
 *
 * Properties are prefixed with "wikidata" in application.yml.
 */
@ConfigurationProperties(prefix = "wikidata")
public class WikidataProperties {
    /** Action API used for text search (wbsearchentities) */
    private String searchUrl = "https://www.wikidata.org/w/api.php";
    /** SPARQL query service endpoint */
    private String sparqlUrl = "https://query.wikidata.org/sparql";
    /** Sent on every request; the public endpoints reject anonymous clients */
    private String userAgent = "kg-bio-lookup/0.1 (https://github.com/kgbio/kg-bio-lookup)";
    /** Per-call timeout in milliseconds; a timed out call fails without retry */
    private int timeoutMs = 30000;
    /** Candidates requested from text search */
    private int searchLimit = 5;
    /** Label language when a request does not carry one */
    private String defaultLanguage = "en";
    /** Max response body buffered in memory */
    private int maxInMemorySize = 16 * 1024 * 1024;

    public String getSearchUrl() { return searchUrl; }
    public void setSearchUrl(String searchUrl) { this.searchUrl = searchUrl; }

    public String getSparqlUrl() { return sparqlUrl; }
    public void setSparqlUrl(String sparqlUrl) { this.sparqlUrl = sparqlUrl; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public int getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }

    public int getSearchLimit() { return searchLimit; }
    public void setSearchLimit(int searchLimit) { this.searchLimit = searchLimit; }

    public String getDefaultLanguage() { return defaultLanguage; }
    public void setDefaultLanguage(String defaultLanguage) { this.defaultLanguage = defaultLanguage; }

    public int getMaxInMemorySize() { return maxInMemorySize; }
    public void setMaxInMemorySize(int maxInMemorySize) { this.maxInMemorySize = maxInMemorySize; }
}
