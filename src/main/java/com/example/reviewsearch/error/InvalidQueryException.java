package com.example.reviewsearch.error;

/**
 * Rejected request input: a bad URL or a filter parameter that cannot be applied.
 */
public class InvalidQueryException extends ReviewSearchException {

    private final String parameter;

    public InvalidQueryException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() { return parameter; }
}
