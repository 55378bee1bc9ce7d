package io.teamrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        long id,
        MessageType type,
        String sender,
        String recipient,
        String content,
        String summary,
        String requestId,
        Boolean approve,
        String color,
        boolean read,
        String timestamp
) {
    public Message withRead(boolean flag) {
        return new Message(id, type, sender, recipient, content, summary, requestId, approve, color, flag, timestamp);
    }
}
