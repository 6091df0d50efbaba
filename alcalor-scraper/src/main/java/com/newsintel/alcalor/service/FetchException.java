package com.newsintel.alcalor.service;

import lombok.Getter;

/**
 * A page could not be fetched.
 *
 * TRANSIENT means transport failures (timeouts, resets) outlasted every retry;
 * PERMANENT means the server answered with an error status, which is never retried.
 * Either way the caller treats the page as lost for this run.
 */
@Getter
public class FetchException extends Exception {

    public enum Kind { TRANSIENT, PERMANENT }

    private final Kind kind;
    private final String url;
    private final Integer statusCode;   // null for transport failures
    private final int attempts;

    private FetchException(Kind kind, String url, Integer statusCode, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public static FetchException permanent(String url, int statusCode, int attempts, Throwable cause) {
        return new FetchException(Kind.PERMANENT, url, statusCode, attempts,
                "HTTP " + statusCode + " for " + url, cause);
    }

    public static FetchException transientFailure(String url, int attempts, Throwable cause) {
        return new FetchException(Kind.TRANSIENT, url, null, attempts,
                "Transport failure for " + url + " after " + attempts + " attempt(s): " + cause.getMessage(), cause);
    }
}
