package com.campus.messaging.handler;

import com.campus.messaging.domain.ConnectionTarget;
import com.campus.messaging.exception.SessionPreconditionException;
import com.campus.messaging.infrastructure.ConnectionFactory;
import com.campus.messaging.infrastructure.ConnectionHandle;
import com.campus.messaging.infrastructure.ConnectionListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.URI;

@Slf4j
@Component
public class WebSocketConnectionFactory implements ConnectionFactory {

    private final ObjectProvider<WebSocketClient> webSocketClient;
    private final int sendTimeLimitMs;
    private final int sendBufferLimitBytes;

    public WebSocketConnectionFactory(ObjectProvider<WebSocketClient> webSocketClient,
                                      @Value("${messaging.socket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                                      @Value("${messaging.socket.send-buffer-limit-bytes:524288}") int sendBufferLimitBytes) {
        this.webSocketClient = webSocketClient;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferLimitBytes = sendBufferLimitBytes;
    }

    @Override
    public ConnectionHandle open(ConnectionTarget target, ConnectionListener listener) {
        if (!target.hasAuthToken()) {
            throw new SessionPreconditionException("no credential");
        }
        if (!target.hasConversationId()) {
            throw new SessionPreconditionException("no conversation id");
        }

        URI uri;
        try {
            uri = target.toUri();
        } catch (IllegalArgumentException e) {
            throw new SessionPreconditionException("invalid endpoint: " + e.getMessage(), e);
        }

        WebSocketClient client = webSocketClient.getIfAvailable();
        if (client == null) {
            throw new SessionPreconditionException("transport unavailable");
        }

        WebSocketConnection connection = new WebSocketConnection(
                target.getConversationId(), listener, sendTimeLimitMs, sendBufferLimitBytes);

        log.info("Opening WebSocket: conversationId={}, host={}", target.getConversationId(), uri.getHost());
        connection.connect(client, uri);
        return connection;
    }
}
