package com.voltquery.exception;

/**
 * Indexed data for a domain/key is missing or older than its TTL.
 * Retrieval tools answer it with a refresh fetch.
 */
public class StaleDataException extends VoltQueryException {

    private final String domain;
    private final String filterValue;

    public StaleDataException(String domain, String filterValue) {
        super("Indexed " + domain + " data for '" + filterValue + "' is stale or absent");
        this.domain = domain;
        this.filterValue = filterValue;
    }

    public String getDomain() {
        return domain;
    }

    public String getFilterValue() {
        return filterValue;
    }
}
