package com.campus.messaging.infrastructure;

import com.campus.messaging.domain.ChatMessage;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * Append-only log of the messages of one session, in arrival order.
 *
 * Every read is a fresh view over everything accumulated so far, so a view can
 * be re-read from the beginning at any time. Only the owning session appends.
 */
public class MessageStream {

    private final List<ChatMessage> messages = new CopyOnWriteArrayList<>();

    void append(ChatMessage message) {
        messages.add(Objects.requireNonNull(message, "message"));
    }

    void appendAll(Collection<ChatMessage> batch) {
        batch.forEach(this::append);
    }

    public List<ChatMessage> snapshot() {
        return List.copyOf(messages);
    }

    public Stream<ChatMessage> stream() {
        return snapshot().stream();
    }

    /**
     * Messages appended at or after {@code fromIndex}; empty when nothing new arrived.
     */
    public List<ChatMessage> since(int fromIndex) {
        if (fromIndex < 0) {
            throw new IllegalArgumentException("Index must not be negative: " + fromIndex);
        }
        List<ChatMessage> all = snapshot();
        if (fromIndex >= all.size()) {
            return List.of();
        }
        return all.subList(fromIndex, all.size());
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * Calendar-day buckets for display, in order of first appearance. Arrival
     * order is kept inside each day. A message without a timestamp joins the
     * day of the message before it (today when it is the first).
     */
    public Map<LocalDate, List<ChatMessage>> groupByDate(ZoneId zone) {
        Map<LocalDate, List<ChatMessage>> groups = new LinkedHashMap<>();
        LocalDate current = null;
        for (ChatMessage message : snapshot()) {
            if (message.getCreatedAt() != null) {
                current = message.getCreatedAt().atZone(zone).toLocalDate();
            } else if (current == null) {
                current = LocalDate.now(zone);
            }
            groups.computeIfAbsent(current, day -> new ArrayList<>()).add(message);
        }
        return groups;
    }
}
