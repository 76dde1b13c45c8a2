package com.campus.messaging.handler;

import com.campus.messaging.domain.ConnectionTarget;
import com.campus.messaging.exception.SessionPreconditionException;
import com.campus.messaging.infrastructure.ConnectionHandle;
import com.campus.messaging.infrastructure.ConnectionListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebSocketConnectionFactoryTest {

    @Mock
    private ObjectProvider<WebSocketClient> clientProvider;

    @Mock
    private WebSocketClient client;

    @Mock
    private ConnectionListener listener;

    private WebSocketConnectionFactory factory;

    @BeforeEach
    void setUp() {
        factory = new WebSocketConnectionFactory(clientProvider, 10_000, 512 * 1024);
    }

    private static ConnectionTarget.ConnectionTargetBuilder target() {
        return ConnectionTarget.builder()
            .conversationId("42")
            .endpointBaseUrl("https://campus.example.edu")
            .authToken("tok");
    }

    @Test
    void shouldStartHandshakeAgainstConversationUrl() {
        when(clientProvider.getIfAvailable()).thenReturn(client);
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
            .thenReturn(new CompletableFuture<>());

        ConnectionHandle handle = factory.open(target().build(), listener);

        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(client).execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), uri.capture());
        assertThat(uri.getValue()).hasToString("wss://campus.example.edu/ws/messages/42/?token=tok");
        assertThat(handle).isInstanceOf(WebSocketConnection.class);
        assertThat(handle.isOpen()).isFalse();
        verifyNoInteractions(listener);
    }

    @Test
    void shouldRefuseWithoutToken() {
        assertThatThrownBy(() -> factory.open(target().authToken(" ").build(), listener))
            .isInstanceOf(SessionPreconditionException.class)
            .hasMessage("no credential");
        verifyNoInteractions(clientProvider);
    }

    @Test
    void shouldRefuseWithoutConversation() {
        assertThatThrownBy(() -> factory.open(target().conversationId(null).build(), listener))
            .isInstanceOf(SessionPreconditionException.class)
            .hasMessage("no conversation id");
    }

    @Test
    void shouldRefuseUnusableEndpoint() {
        assertThatThrownBy(() -> factory.open(target().endpointBaseUrl("not-a-url").build(), listener))
            .isInstanceOf(SessionPreconditionException.class)
            .hasMessageStartingWith("invalid endpoint");
    }

    @Test
    void shouldRefuseWhenNoTransportIsAvailable() {
        when(clientProvider.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> factory.open(target().build(), listener))
            .isInstanceOf(SessionPreconditionException.class)
            .hasMessage("transport unavailable");
    }
}
