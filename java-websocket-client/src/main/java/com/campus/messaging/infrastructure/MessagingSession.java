package com.campus.messaging.infrastructure;

import com.campus.messaging.domain.ChatMessage;
import com.campus.messaging.domain.ConnectionTarget;
import com.campus.messaging.domain.SessionState;
import com.campus.messaging.domain.SessionState.Phase;
import com.campus.messaging.domain.SubmitResult;
import com.campus.messaging.domain.TypingPresence;
import com.campus.messaging.exception.FrameSendException;
import com.campus.messaging.exception.MalformedFrameException;
import com.campus.messaging.exception.SessionPreconditionException;
import com.campus.messaging.model.InboundFrame;
import com.campus.messaging.model.OutboundFrame;
import com.campus.messaging.service.CredentialAccessor;
import com.campus.messaging.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Realtime connection to one conversation for one local participant.
 *
 * <p>Owns at most one live {@link ConnectionHandle}, reconnects with
 * {@link BackoffPolicy} after abnormal closes, routes inbound frames into the
 * {@link MessageStream} and typing presence, and frames outbound text.
 *
 * <p>Every transition happens while holding {@code lock}. Caller methods,
 * connection callbacks and timer callbacks all take it, so two reconnect
 * attempts can never race. Each connection attempt carries a sequence number and
 * each timer the session epoch; callbacks from a discarded attempt or an earlier
 * {@link #start()}/{@link #stop()} cycle are ignored.
 */
@Slf4j
public class MessagingSession {

    static final String STOP_REASON = "client stopping";
    static final String NO_CREDENTIAL = "no credential";
    static final String NO_CONVERSATION = "no conversation id";
    static final String RETRIES_EXHAUSTED_MESSAGE = "Connection lost. Please refresh the page to reconnect.";
    static final String AUTH_FAILED_MESSAGE = "Authentication error. Please log in again.";

    private final String conversationId;
    private final String localUserId;
    private final String endpointBaseUrl;
    private final CredentialAccessor credentials;
    private final ConnectionFactory connectionFactory;
    private final FrameCodec frameCodec;
    private final BackoffPolicy backoffPolicy;
    private final MetricsService metricsService;
    private final SessionListener listener;

    private final Object lock = new Object();
    private final MessageStream messageStream = new MessageStream();
    private final SessionTimer reconnectTimer;
    private final TypingPresenceDebouncer typing;

    private volatile SessionState state = SessionState.idle();
    private volatile String lastError;
    private ConnectionHandle handle;
    private boolean handleCounted;
    private long epoch;
    private long connectionSeq;
    private int attempt;

    public MessagingSession(String conversationId,
                            String localUserId,
                            String endpointBaseUrl,
                            CredentialAccessor credentials,
                            ConnectionFactory connectionFactory,
                            FrameCodec frameCodec,
                            BackoffPolicy backoffPolicy,
                            TypingSettings typingSettings,
                            TaskScheduler scheduler,
                            MetricsService metricsService,
                            SessionListener listener) {
        this.conversationId = conversationId;
        this.localUserId = localUserId;
        this.endpointBaseUrl = endpointBaseUrl;
        this.credentials = credentials;
        this.connectionFactory = connectionFactory;
        this.frameCodec = frameCodec;
        this.backoffPolicy = backoffPolicy;
        this.metricsService = metricsService;
        this.listener = listener != null ? listener : new SessionListener() { };

        this.reconnectTimer = new SessionTimer("reconnect", scheduler, lock, this::currentEpoch);
        this.typing = new TypingPresenceDebouncer(
            new SessionTimer("typing-debounce", scheduler, lock, this::currentEpoch),
            new SessionTimer("typing-stop", scheduler, lock, this::currentEpoch),
            new SessionTimer("remote-typing-expiry", scheduler, lock, this::currentEpoch),
            typingSettings,
            this::isConnected,
            this::sendTypingBestEffort,
            this::publishPresence);
    }

    // ===== Lifecycle =====

    /**
     * Begin connecting. Ignored while a connection cycle is already running.
     */
    public void start() {
        synchronized (lock) {
            if (!state.isTerminal()) {
                log.debug("Session already running: conversationId={}, state={}", conversationId, state);
                return;
            }
            epoch++;
            attempt = 0;
            lastError = null;
            log.info("Starting messaging session: conversationId={}, backoff={}", conversationId, backoffPolicy);
            connect(0);
        }
    }

    /**
     * Close the connection with 1000 "client stopping", cancel every timer and
     * return to Idle. Safe to call repeatedly. Nothing is reported after this returns.
     */
    public void stop() {
        ConnectionHandle toClose;
        synchronized (lock) {
            epoch++;
            connectionSeq++;
            reconnectTimer.cancel();
            typing.remoteStopped();
            typing.cancelAll();
            toClose = handle;
            handle = null;
            releaseCountedHandle();
            attempt = 0;
            if (!state.is(Phase.IDLE)) {
                log.info("Stopping messaging session: conversationId={}, state={}", conversationId, state);
                transition(SessionState.idle());
            }
        }
        closeQuietly(toClose, ConnectionHandle.NORMAL_CLOSURE, STOP_REASON);
    }

    // ===== Caller input =====

    /**
     * Send a chat message. Only accepted while Connected; nothing is buffered.
     */
    public SubmitResult submit(String text) {
        synchronized (lock) {
            if (text == null || text.isBlank()) {
                return SubmitResult.empty();
            }
            if (!isConnected()) {
                log.debug("Rejecting send while not connected: conversationId={}, state={}", conversationId, state);
                return SubmitResult.notReady(state);
            }

            String content = text.trim();
            typing.cancelLocal();
            sendTypingBestEffort(false);

            try {
                handle.send(frameCodec.encode(OutboundFrame.chat(conversationId, content)));
            } catch (FrameSendException e) {
                log.warn("Failed to send message: conversationId={}, error={}", conversationId, e.getMessage());
                metricsService.recordSendFailure("chat");
                lastError = "Failed to send message. Please try again.";
                return SubmitResult.failed(lastError);
            }

            metricsService.recordFrameSent("chat");
            return SubmitResult.sent(ChatMessage.provisional(conversationId, localUserId, content));
        }
    }

    /**
     * Report local input activity with the current contents of the input box.
     * Blank input does not count as typing.
     */
    public void onLocalInput(String currentText) {
        if (currentText == null || currentText.isBlank()) {
            return;
        }
        synchronized (lock) {
            typing.onLocalInput();
        }
    }

    /**
     * Preload previously persisted messages ahead of any live frame.
     *
     * @return number of messages appended
     * @throws IllegalStateException unless the session is Idle
     */
    public int seedHistory(List<ChatMessage> history) {
        synchronized (lock) {
            if (!state.is(Phase.IDLE)) {
                throw new IllegalStateException("History can only be seeded before start: state=" + state);
            }
            if (history == null || history.isEmpty()) {
                return 0;
            }
            messageStream.appendAll(history);
            log.debug("Seeded {} history messages: conversationId={}", history.size(), conversationId);
            return history.size();
        }
    }

    // ===== Read-only views =====

    public SessionState getState() {
        return state;
    }

    public MessageStream getMessages() {
        return messageStream;
    }

    public TypingPresence getPresence() {
        synchronized (lock) {
            return typing.current();
        }
    }

    public String getLastError() {
        return lastError;
    }

    public String getConversationId() {
        return conversationId;
    }

    public boolean hasLiveConnection() {
        synchronized (lock) {
            return handle != null && handle.isOpen();
        }
    }

    // ===== Connection cycle (caller holds lock) =====

    private void connect(int attemptNumber) {
        discardHandle("reconnecting");
        attempt = attemptNumber;

        Optional<String> token;
        try {
            token = credentials.getAuthToken().filter(CredentialAccessor::isUsable);
        } catch (RuntimeException e) {
            log.error("Credential store failed: conversationId={}", conversationId, e);
            token = Optional.empty();
        }
        if (token.isEmpty()) {
            log.error("No authentication token found for WebSocket connection: conversationId={}", conversationId);
            failPermanently(NO_CREDENTIAL, AUTH_FAILED_MESSAGE);
            return;
        }
        if (conversationId == null || conversationId.isBlank()) {
            failPermanently(NO_CONVERSATION, "Configuration error. Please refresh the page.");
            return;
        }

        long cycle = epoch;
        transition(SessionState.connecting(attemptNumber));
        if (cycle != epoch) {
            return;
        }
        metricsService.recordConnectionAttempt(conversationId, attemptNumber);
        log.info("Connecting: conversationId={}, attempt={}/{}", conversationId, attemptNumber + 1,
                backoffPolicy.getMaxAttempts());

        ConnectionTarget target = ConnectionTarget.builder()
            .conversationId(conversationId)
            .endpointBaseUrl(endpointBaseUrl)
            .authToken(token.get())
            .build();

        long seq = ++connectionSeq;
        ConnectionHandle opened;
        try {
            opened = connectionFactory.open(target, new AttemptListener(seq));
        } catch (SessionPreconditionException e) {
            log.error("Cannot connect: conversationId={}, reason={}", conversationId, e.getMessage());
            failPermanently(e.getMessage(), "Cannot establish connection: " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Error creating WebSocket connection: conversationId={}", conversationId, e);
            connectionSeq++;
            connectionLost("Failed to connect: " + e.getMessage(), attemptNumber);
            return;
        }

        if (seq == connectionSeq) {
            handle = opened;
        } else {
            // the attempt already ended inside open(); make sure nothing stays open
            closeQuietly(opened, ConnectionHandle.NORMAL_CLOSURE, "superseded");
        }
    }

    private void onOpened(ConnectionHandle opened) {
        handle = opened;
        if (!state.is(Phase.CONNECTING)) {
            return;
        }
        attempt = 0;
        lastError = null;
        metricsService.recordConnectionOpened(conversationId);
        handleCounted = true;
        log.info("WebSocket connection established: conversationId={}", conversationId);
        transition(SessionState.connected());
    }

    private void onError(Throwable error) {
        String reason = "Connection error: " + describe(error);
        lastError = reason;
        if (state.is(Phase.CONNECTING)) {
            connectionSeq++;
            connectionLost(reason, attempt);
        } else {
            log.warn("Transport error while connected: conversationId={}, error={}", conversationId, describe(error));
        }
    }

    private void onClosed(int code, String reason) {
        metricsService.recordConnectionClosed(conversationId, code);
        connectionSeq++;
        handle = null;
        releaseCountedHandle();

        if (code == ConnectionHandle.NORMAL_CLOSURE) {
            log.info("WebSocket closed normally: conversationId={}", conversationId);
            reconnectTimer.cancel();
            typing.remoteStopped();
            typing.cancelAll();
            transition(SessionState.idle());
            return;
        }

        String description = "closed with code " + code + (reason != null && !reason.isBlank() ? ": " + reason : "");
        connectionLost(description, state.is(Phase.CONNECTED) ? 0 : attempt);
    }

    private void handleFrame(String payload) {
        if (!state.is(Phase.CONNECTED)) {
            log.debug("Dropping frame received while {}: conversationId={}", state, conversationId);
            return;
        }

        InboundFrame frame;
        try {
            frame = frameCodec.decode(payload, conversationId);
        } catch (MalformedFrameException e) {
            log.warn("Error parsing WebSocket message: conversationId={}, error={}", conversationId, e.getMessage());
            metricsService.recordFrameDropped("malformed");
            return;
        }

        metricsService.recordFrameReceived(frame.getKind().name().toLowerCase(Locale.ROOT));
        switch (frame.getKind()) {
            case TYPING -> handleRemoteTyping(frame);
            case CHAT -> {
                long cycle = epoch;
                messageStream.append(frame.getMessage());
                typing.remoteStopped();
                if (cycle == epoch) {
                    notifyMessage(frame.getMessage());
                }
            }
            case IGNORED -> log.debug("Ignoring frame without content: conversationId={}", conversationId);
        }
    }

    private void handleRemoteTyping(InboundFrame frame) {
        if (localUserId != null && localUserId.equals(frame.getUserId())) {
            return;
        }
        if (frame.isTyping()) {
            typing.remoteStarted(frame.getUserId());
        } else {
            typing.remoteStopped();
        }
    }

    /**
     * Leave Connecting/Connected for Disconnected and schedule the next attempt,
     * or give up when the attempt ceiling is reached.
     */
    private void connectionLost(String reason, int failedAttempt) {
        lastError = reason;
        discardHandle("connection lost");
        typing.cancelLocal();
        typing.remoteStopped();
        long cycle = epoch;
        transition(SessionState.disconnected(reason, failedAttempt));
        if (cycle != epoch) {
            return;
        }

        int nextAttempt = failedAttempt + 1;
        if (!backoffPolicy.allowsAttempt(nextAttempt)) {
            log.warn("Giving up after {} attempts: conversationId={}, reason={}", nextAttempt, conversationId, reason);
            failPermanently(reason, RETRIES_EXHAUSTED_MESSAGE);
            return;
        }

        Duration delay = backoffPolicy.delay(failedAttempt);
        log.info("Retrying connection in {}ms: conversationId={}, nextAttempt={}", delay.toMillis(), conversationId,
                nextAttempt);
        reconnectTimer.arm(delay, () -> connect(nextAttempt));
    }

    private void failPermanently(String reason, String userMessage) {
        lastError = userMessage;
        reconnectTimer.cancel();
        typing.cancelAll();
        discardHandle("connection failed");
        metricsService.recordSessionFailed(conversationId, reason);
        long cycle = epoch;
        transition(SessionState.connectionFailed(reason));
        if (cycle == epoch) {
            notifyFatal(userMessage);
        }
    }

    private void discardHandle(String reason) {
        ConnectionHandle previous = handle;
        handle = null;
        releaseCountedHandle();
        closeQuietly(previous, ConnectionHandle.NORMAL_CLOSURE, reason);
    }

    /**
     * Later close callbacks of the released handle are ignored, so the live
     * gauge is settled here, once per handle that reached Connected.
     */
    private void releaseCountedHandle() {
        if (handleCounted) {
            handleCounted = false;
            metricsService.recordConnectionReleased(conversationId);
        }
    }

    // ===== Helpers =====

    private boolean isConnected() {
        return state.is(Phase.CONNECTED) && handle != null;
    }

    private long currentEpoch() {
        return epoch;
    }

    private void sendTypingBestEffort(boolean isTyping) {
        if (!isConnected()) {
            return;
        }
        try {
            handle.send(frameCodec.encode(OutboundFrame.typing(conversationId, isTyping)));
            metricsService.recordFrameSent("typing");
        } catch (FrameSendException e) {
            log.debug("Error sending typing indicator: conversationId={}, error={}", conversationId, e.getMessage());
            metricsService.recordSendFailure("typing");
        }
    }

    private void transition(SessionState next) {
        SessionState previous = state;
        state = next;
        log.debug("Session state: conversationId={}, {} -> {}", conversationId, previous, next);
        try {
            listener.onStateChange(next);
        } catch (RuntimeException e) {
            log.error("Listener failed on state change: conversationId={}", conversationId, e);
        }
    }

    private void notifyMessage(ChatMessage message) {
        try {
            listener.onMessage(message);
        } catch (RuntimeException e) {
            log.error("Listener failed on message: conversationId={}", conversationId, e);
        }
    }

    private void publishPresence(TypingPresence presence) {
        try {
            listener.onPresenceChange(presence);
        } catch (RuntimeException e) {
            log.error("Listener failed on presence change: conversationId={}", conversationId, e);
        }
    }

    private void notifyFatal(String message) {
        try {
            listener.onFatalError(message);
        } catch (RuntimeException e) {
            log.error("Listener failed on fatal error: conversationId={}", conversationId, e);
        }
    }

    private void closeQuietly(ConnectionHandle target, int code, String reason) {
        if (target == null) {
            return;
        }
        try {
            target.close(code, reason);
        } catch (RuntimeException e) {
            log.warn("Error closing connection: conversationId={}, error={}", conversationId, e.getMessage());
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Binds transport callbacks to one connection attempt.
     */
    private final class AttemptListener implements ConnectionListener {

        private final long seq;

        private AttemptListener(long seq) {
            this.seq = seq;
        }

        @Override
        public void onOpened(ConnectionHandle opened) {
            dispatch("opened", () -> MessagingSession.this.onOpened(opened));
        }

        @Override
        public void onMessage(ConnectionHandle source, String payload) {
            dispatch("message", () -> handleFrame(payload));
        }

        @Override
        public void onError(ConnectionHandle source, Throwable error) {
            dispatch("error", () -> MessagingSession.this.onError(error));
        }

        @Override
        public void onClosed(ConnectionHandle source, int code, String reason) {
            dispatch("closed", () -> MessagingSession.this.onClosed(code, reason));
        }

        private void dispatch(String event, Runnable action) {
            synchronized (lock) {
                if (seq != connectionSeq) {
                    log.trace("Ignoring {} from a discarded connection: conversationId={}", event, conversationId);
                    return;
                }
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.error("Error handling connection event: event={}, conversationId={}", event, conversationId, e);
                }
            }
        }
    }
}
