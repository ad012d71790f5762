package com.ai.clinicbot.conversation;

import java.util.UUID;

/**
 * One inbound chat turn handed to the conversation engine.
 */
public record BotRequest(UUID lineId, String patientPhone, String messageText, UUID organizationId) {
}
