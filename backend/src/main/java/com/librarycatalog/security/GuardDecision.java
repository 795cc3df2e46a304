package com.librarycatalog.security;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Either "proceed" or a rejection with the status and body to send.
 */
public record GuardDecision(HttpStatus status, Map<String, Object> body) {

    private static final GuardDecision PROCEED = new GuardDecision(null, Map.of());

    public static GuardDecision proceed() {
        return PROCEED;
    }

    public static GuardDecision reject(HttpStatus status, Map<String, Object> body) {
        return new GuardDecision(status, Map.copyOf(body));
    }

    public boolean isAllowed() {
        return status == null;
    }
}
