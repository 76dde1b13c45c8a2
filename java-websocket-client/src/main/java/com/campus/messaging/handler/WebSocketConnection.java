package com.campus.messaging.handler;

import com.campus.messaging.exception.FrameSendException;
import com.campus.messaging.infrastructure.ConnectionHandle;
import com.campus.messaging.infrastructure.ConnectionListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client side of one chat socket, wrapping a Spring {@link WebSocketSession}.
 *
 * Reports {@code onClosed} exactly once, whether the handshake failed, the
 * server closed, or {@link #close} was called.
 */
@Slf4j
public class WebSocketConnection extends TextWebSocketHandler implements ConnectionHandle {

    private final String conversationId;
    private final ConnectionListener listener;
    private final int sendTimeLimitMs;
    private final int sendBufferLimitBytes;

    private final AtomicBoolean closeRequested = new AtomicBoolean(false);
    private final AtomicBoolean closedReported = new AtomicBoolean(false);
    private volatile WebSocketSession session;

    public WebSocketConnection(String conversationId,
                               ConnectionListener listener,
                               int sendTimeLimitMs,
                               int sendBufferLimitBytes) {
        this.conversationId = conversationId;
        this.listener = listener;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferLimitBytes = sendBufferLimitBytes;
    }

    /**
     * Start the handshake. Returns immediately.
     */
    void connect(WebSocketClient client, URI uri) {
        client.execute(this, new WebSocketHttpHeaders(), uri).whenComplete((wsSession, ex) -> {
            if (ex != null) {
                log.warn("WebSocket handshake failed: conversationId={}, error={}", conversationId, ex.getMessage());
                listener.onError(this, ex);
                reportClosed(ABNORMAL_CLOSURE, "Handshake failed: " + ex.getMessage());
            }
        });
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        // Spring sessions do not allow concurrent sends; typing timers and caller sends can overlap
        this.session = new ConcurrentWebSocketSessionDecorator(wsSession, sendTimeLimitMs, sendBufferLimitBytes);

        if (closeRequested.get()) {
            log.debug("Closing socket opened after close was requested: conversationId={}", conversationId);
            wsSession.close(CloseStatus.NORMAL);
            return;
        }

        log.info("WebSocket connected: wsId={}, conversationId={}", wsSession.getId(), conversationId);
        listener.onOpened(this);
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        listener.onMessage(this, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.warn("WebSocket transport error: wsId={}, conversationId={}, error={}",
                wsSession.getId(), conversationId, exception.getMessage());
        listener.onError(this, exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        log.info("WebSocket closed: wsId={}, conversationId={}, code={}, reason={}",
                wsSession.getId(), conversationId, status.getCode(), status.getReason());
        reportClosed(status.getCode(), status.getReason());
    }

    @Override
    public void send(String frame) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen() || closeRequested.get()) {
            throw new FrameSendException("Connection is not open: conversationId=" + conversationId);
        }
        try {
            current.sendMessage(new TextMessage(frame));
        } catch (IOException | IllegalStateException e) {
            throw new FrameSendException("Failed to send frame: conversationId=" + conversationId, e);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!closeRequested.compareAndSet(false, true)) {
            return;
        }
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            current.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.warn("Error closing WebSocket: conversationId={}, error={}", conversationId, e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        WebSocketSession current = session;
        return current != null && current.isOpen() && !closeRequested.get();
    }

    private void reportClosed(int code, String reason) {
        if (closedReported.compareAndSet(false, true)) {
            listener.onClosed(this, code, reason);
        }
    }
}
