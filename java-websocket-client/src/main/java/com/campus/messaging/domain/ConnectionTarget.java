package com.campus.messaging.domain;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Where and as whom a session connects.
 *
 * {@code endpointBaseUrl} is the origin of the hosting application, e.g.
 * {@code https://campus.example.edu} or {@code http://localhost:8000}; a secure
 * origin yields a {@code wss} socket, anything else {@code ws}.
 */
@Value
@Builder
public class ConnectionTarget {

    private static final String SOCKET_PATH = "/ws/messages/";

    String conversationId;
    String endpointBaseUrl;

    @ToString.Exclude
    String authToken;

    public boolean hasConversationId() {
        return conversationId != null && !conversationId.isBlank();
    }

    public boolean hasAuthToken() {
        return authToken != null && !authToken.isBlank();
    }

    /**
     * {@code {scheme}://{host}/ws/messages/{conversationId}/?token={token}} with
     * both variable parts percent-encoded as URI components.
     *
     * @throws IllegalArgumentException if the base URL has no usable scheme or host
     */
    public URI toUri() {
        if (endpointBaseUrl == null || endpointBaseUrl.isBlank()) {
            throw new IllegalArgumentException("Endpoint base URL is not configured");
        }
        URI base = URI.create(endpointBaseUrl.trim());
        if (base.getScheme() == null || base.getRawAuthority() == null) {
            throw new IllegalArgumentException("Endpoint base URL needs a scheme and host: " + endpointBaseUrl);
        }

        String scheme = isSecure(base.getScheme()) ? "wss" : "ws";
        String encodedConversation = UriUtils.encode(conversationId, StandardCharsets.UTF_8);
        String encodedToken = UriUtils.encode(authToken, StandardCharsets.UTF_8);

        return URI.create(scheme + "://" + base.getRawAuthority() + SOCKET_PATH
            + encodedConversation + "/?token=" + encodedToken);
    }

    private static boolean isSecure(String scheme) {
        String normalized = scheme.toLowerCase(Locale.ROOT);
        return normalized.equals("https") || normalized.equals("wss");
    }
}
