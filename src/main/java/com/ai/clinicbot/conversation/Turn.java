package com.ai.clinicbot.conversation;

import com.ai.clinicbot.conversation.context.ConversationContext;
import com.ai.clinicbot.entity.BotSession;
import com.ai.clinicbot.entity.ChannelLine;

import java.util.UUID;

/**
 * Everything a state handler may read for one inbound message. Handlers mutate
 * {@link #context()} and return a {@link BotResponse}; the engine persists both.
 */
public record Turn(BotSession session, ChannelLine line, UUID organizationId, String input, ConversationContext context) {

    public UUID lineId() {
        return session.getLineId();
    }

    public String patientPhone() {
        return session.getPatientPhone();
    }
}
