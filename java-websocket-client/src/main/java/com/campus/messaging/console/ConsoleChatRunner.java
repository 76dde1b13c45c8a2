package com.campus.messaging.console;

import com.campus.messaging.domain.ChatMessage;
import com.campus.messaging.domain.GroupInfo;
import com.campus.messaging.domain.SessionState;
import com.campus.messaging.domain.SubmitResult;
import com.campus.messaging.domain.TypingPresence;
import com.campus.messaging.infrastructure.MessagingSession;
import com.campus.messaging.infrastructure.SessionListener;
import com.campus.messaging.service.ConversationHistoryClient;
import com.campus.messaging.service.MessagingSessionFactory;
import com.campus.messaging.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Line-oriented chat client: each input line is sent as a message, {@code /quit}
 * ends the session. Enabled with {@code messaging.console.enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "messaging.console.enabled", havingValue = "true")
public class ConsoleChatRunner implements CommandLineRunner {

    static final String QUIT_COMMAND = "/quit";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final MessagingSessionFactory sessionFactory;
    private final ConversationHistoryClient historyClient;
    private final MetricsService metricsService;
    private final String conversationId;
    private final String localUserId;

    private InputStream input = System.in;
    private PrintStream output = System.out;

    public ConsoleChatRunner(MessagingSessionFactory sessionFactory,
                             ConversationHistoryClient historyClient,
                             MetricsService metricsService,
                             @Value("${messaging.console.conversation-id:}") String conversationId,
                             @Value("${messaging.console.user-id:}") String localUserId) {
        this.sessionFactory = sessionFactory;
        this.historyClient = historyClient;
        this.metricsService = metricsService;
        this.conversationId = conversationId;
        this.localUserId = localUserId;
    }

    void setStreams(InputStream input, PrintStream output) {
        this.input = input;
        this.output = output;
    }

    @Override
    public void run(String... args) throws IOException {
        GroupInfo group = historyClient.fetchGroupMetadata(conversationId);
        output.println("== " + group.displayNameFor(localUserId) + " ==");

        MessagingSession session = sessionFactory.open(conversationId, localUserId, new ConsoleListener());
        session.getMessages().stream().forEach(this::print);

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (QUIT_COMMAND.equals(line.trim())) {
                    break;
                }
                SubmitResult result = session.submit(line);
                switch (result.getStatus()) {
                    case NOT_READY -> output.println("! not connected (" + session.getState() + ")");
                    case FAILED -> output.println("! " + result.getErrorMessage());
                    default -> {
                    }
                }
            }
        } finally {
            session.stop();
            metricsService.printSummary();
        }
    }

    private void print(ChatMessage message) {
        String time = message.getCreatedAt() != null
            ? TIME_FORMAT.format(message.getCreatedAt().atZone(ZoneId.systemDefault()))
            : "--:--";
        String sender = message.getSenderDisplayName() != null ? message.getSenderDisplayName() : message.getSenderId();
        output.println("[" + time + "] " + sender + ": " + message.getContent());
    }

    private class ConsoleListener implements SessionListener {

        @Override
        public void onStateChange(SessionState state) {
            output.println("* " + state);
        }

        @Override
        public void onMessage(ChatMessage message) {
            print(message);
        }

        @Override
        public void onPresenceChange(TypingPresence presence) {
            if (presence.isRemoteTyping()) {
                output.println("* typing...");
            }
        }

        @Override
        public void onFatalError(String message) {
            output.println("! " + message);
            log.warn("Session ended: conversationId={}, error={}", conversationId, message);
        }
    }
}
