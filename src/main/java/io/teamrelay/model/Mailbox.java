package io.teamrelay.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered message log of one agent. {@code lastId} only grows; messages are never removed.
 */
public record Mailbox(long lastId, List<Message> messages) {
    public Mailbox {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static Mailbox empty() {
        return new Mailbox(0L, List.of());
    }

    public Mailbox append(Message message) {
        List<Message> next = new ArrayList<>(messages.size() + 1);
        next.addAll(messages);
        next.add(message);
        return new Mailbox(Math.max(lastId, message.id()), next);
    }

    public Mailbox withMessages(List<Message> replacement) {
        return new Mailbox(lastId, replacement);
    }
}
