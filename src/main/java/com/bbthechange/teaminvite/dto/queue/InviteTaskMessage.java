package com.bbthechange.teaminvite.dto.queue;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base class for every message on the invite task queue.
 * Jackson resolves the concrete type from the {@code type} property.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "type",
    visible = true
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ReserveSeatTask.class, name = ReserveSeatTask.TYPE),
    @JsonSubTypes.Type(value = DispatchInviteTask.class, name = DispatchInviteTask.TYPE),
    @JsonSubTypes.Type(value = ReconcileQueueTask.class, name = ReconcileQueueTask.TYPE)
})
public abstract class InviteTaskMessage {

    private String type;
    private String messageId;

    public InviteTaskMessage() {}

    public InviteTaskMessage(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }
}
