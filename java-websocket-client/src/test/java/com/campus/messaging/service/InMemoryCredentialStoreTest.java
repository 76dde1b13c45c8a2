package com.campus.messaging.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCredentialStoreTest {

    @Test
    void shouldLoadTokenFromConfiguration() {
        assertThat(new InMemoryCredentialStore(" tok-123 ").getAuthToken()).contains("tok-123");
    }

    @Test
    void shouldStartEmptyWithoutConfiguredToken() {
        assertThat(new InMemoryCredentialStore("").getAuthToken()).isEmpty();
        assertThat(new InMemoryCredentialStore(null).getAuthToken()).isEmpty();
    }

    @Test
    void shouldHidePlaceholderTokens() {
        InMemoryCredentialStore store = new InMemoryCredentialStore("");

        store.store("undefined");
        assertThat(store.getAuthToken()).isEmpty();

        store.store("null");
        assertThat(store.getAuthToken()).isEmpty();

        store.store("real");
        assertThat(store.getAuthToken()).contains("real");

        store.clear();
        assertThat(store.getAuthToken()).isEmpty();
    }

    @Test
    void shouldJudgeTokenUsability() {
        assertThat(CredentialAccessor.isUsable("abc")).isTrue();
        assertThat(CredentialAccessor.isUsable(null)).isFalse();
        assertThat(CredentialAccessor.isUsable("  ")).isFalse();
        assertThat(CredentialAccessor.isUsable(" undefined ")).isFalse();
    }
}
