package com.campus.messaging.handler;

import com.campus.messaging.exception.FrameSendException;
import com.campus.messaging.infrastructure.ConnectionHandle;
import com.campus.messaging.infrastructure.ConnectionListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebSocketConnectionTest {

    @Mock
    private ConnectionListener listener;

    @Mock
    private WebSocketSession wsSession;

    private WebSocketConnection connection;

    @BeforeEach
    void setUp() {
        connection = new WebSocketConnection("42", listener, 10_000, 512 * 1024);
        lenient().when(wsSession.getId()).thenReturn("ws-1");
    }

    @Test
    void shouldReportOpenedAndSendText() throws Exception {
        when(wsSession.isOpen()).thenReturn(true);

        connection.afterConnectionEstablished(wsSession);
        connection.send("{\"content\":\"hi\"}");

        verify(listener).onOpened(connection);
        verify(wsSession).sendMessage(new TextMessage("{\"content\":\"hi\"}"));
        assertThat(connection.isOpen()).isTrue();
    }

    @Test
    void shouldForwardTextFrames() throws Exception {
        connection.handleMessage(wsSession, new TextMessage("{\"type\":\"typing\"}"));

        verify(listener).onMessage(connection, "{\"type\":\"typing\"}");
    }

    @Test
    void shouldReportTransportErrors() throws Exception {
        IOException error = new IOException("reset");

        connection.handleTransportError(wsSession, error);

        verify(listener).onError(connection, error);
        verify(listener, never()).onClosed(any(), anyInt(), any());
    }

    @Test
    void shouldReportCloseOnlyOnce() {
        connection.afterConnectionClosed(wsSession, new CloseStatus(1006, "gone"));
        connection.afterConnectionClosed(wsSession, CloseStatus.NORMAL);

        verify(listener, times(1)).onClosed(connection, 1006, "gone");
        verify(listener, times(1)).onClosed(any(), anyInt(), any());
    }

    @Test
    void shouldRefuseToSendBeforeOpen() {
        assertThatThrownBy(() -> connection.send("x")).isInstanceOf(FrameSendException.class);
    }

    @Test
    void shouldWrapSendFailures() throws Exception {
        when(wsSession.isOpen()).thenReturn(true);
        doThrow(new IOException("broken pipe")).when(wsSession).sendMessage(any());
        connection.afterConnectionEstablished(wsSession);

        assertThatThrownBy(() -> connection.send("x"))
            .isInstanceOf(FrameSendException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void shouldCloseOnceWithGivenStatus() throws Exception {
        when(wsSession.isOpen()).thenReturn(true);
        connection.afterConnectionEstablished(wsSession);

        connection.close(ConnectionHandle.NORMAL_CLOSURE, "client stopping");
        connection.close(ConnectionHandle.NORMAL_CLOSURE, "client stopping");

        verify(wsSession, times(1)).close(new CloseStatus(1000, "client stopping"));
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    void shouldCloseSocketThatOpensAfterCloseWasRequested() throws Exception {
        connection.close(ConnectionHandle.NORMAL_CLOSURE, "client stopping");

        connection.afterConnectionEstablished(wsSession);

        verify(wsSession).close(CloseStatus.NORMAL);
        verify(listener, never()).onOpened(any());
    }

    @Test
    void shouldReportFailedHandshakeAsAbnormalClose() {
        WebSocketClient client = mock(WebSocketClient.class);
        IOException refused = new IOException("refused");
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
            .thenReturn(CompletableFuture.failedFuture(refused));

        connection.connect(client, URI.create("ws://localhost:8000/ws/messages/42/?token=t"));

        verify(listener).onError(connection, refused);
        verify(listener).onClosed(eq(connection), eq(ConnectionHandle.ABNORMAL_CLOSURE), any());
    }
}
