package com.campus.messaging.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default token holder. The login flow stores the access token here; sessions
 * only read it.
 */
@Slf4j
@Component
public class InMemoryCredentialStore implements CredentialAccessor {

    private final AtomicReference<String> token = new AtomicReference<>();

    public InMemoryCredentialStore(@Value("${messaging.auth.token:}") String initialToken) {
        if (CredentialAccessor.isUsable(initialToken)) {
            token.set(initialToken.trim());
            log.info("Access token loaded from configuration");
        }
    }

    @Override
    public Optional<String> getAuthToken() {
        return Optional.ofNullable(token.get()).filter(CredentialAccessor::isUsable);
    }

    public void store(String accessToken) {
        token.set(accessToken);
    }

    public void clear() {
        token.set(null);
    }
}
