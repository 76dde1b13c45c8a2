package com.campus.messaging.service;

import java.util.Optional;

/**
 * Read-only view of the bearer token store. May be read concurrently; the
 * messaging core never writes to it.
 */
public interface CredentialAccessor {

    Optional<String> getAuthToken();

    /**
     * Blank tokens and the literal strings "undefined" and "null" (left behind by
     * careless browser storage) are treated as absent.
     */
    static boolean isUsable(String token) {
        if (token == null) {
            return false;
        }
        String trimmed = token.trim();
        return !trimmed.isEmpty() && !trimmed.equals("undefined") && !trimmed.equals("null");
    }
}
