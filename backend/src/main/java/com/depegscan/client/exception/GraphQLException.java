package com.depegscan.client.exception;

/**
 * Non-transient failure reported by the GraphQL endpoint (query rejected, entity missing, 4xx).
 */
public class GraphQLException extends RuntimeException {

    private final String code;

    public GraphQLException(String message) {
        this(message, null, null);
    }

    public GraphQLException(String message, String code) {
        this(message, code, null);
    }

    public GraphQLException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** True when the endpoint reported that the requested entity does not exist. */
    public boolean isNotFound() {
        if ("NOT_FOUND".equalsIgnoreCase(code)) return true;
        String m = getMessage();
        return m != null && (m.contains("NOT_FOUND") || m.contains("No results matching"));
    }
}
