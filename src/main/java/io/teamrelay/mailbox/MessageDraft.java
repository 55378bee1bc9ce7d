package io.teamrelay.mailbox;

import io.teamrelay.model.MessageType;

/**
 * Message content before the recipient's mailbox assigns its id and timestamp.
 */
public record MessageDraft(
        MessageType type,
        String sender,
        String content,
        String summary,
        String requestId,
        Boolean approve,
        String color
) {
    public MessageDraft {
        type = type == null ? MessageType.DIRECT : type;
        content = content == null ? "" : content;
        summary = summary == null ? "" : summary;
    }

    public static MessageDraft direct(String sender, String content, String summary) {
        return new MessageDraft(MessageType.DIRECT, sender, content, summary, null, null, null);
    }

    public MessageDraft withType(MessageType next) {
        return new MessageDraft(next, sender, content, summary, requestId, approve, color);
    }

    public MessageDraft withColor(String next) {
        return new MessageDraft(type, sender, content, summary, requestId, approve, next);
    }
}
