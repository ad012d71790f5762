package com.ai.clinicbot.messaging;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Logical message types. Each maps to a provider template per line; {@link #GENERIC}
 * is free text.
 */
public enum MessageType {
    CONFIRMATION("confirmation", true),
    REMINDER_24H("reminder_24h", true),
    RESCHEDULE_DOCTOR("reschedule_doctor", false),
    PATIENT_CONFIRMED("patient_confirmed", false),
    PATIENT_RESCHEDULE("patient_reschedule", false),
    GENERIC("generic", false),
    /** Inbound rows only. */
    PATIENT_REPLY("patient_reply", false);

    private final String code;
    private final boolean quickReplies;

    MessageType(String code, boolean quickReplies) {
        this.code = code;
        this.quickReplies = quickReplies;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Templates of this type carry confirm/reschedule buttons. */
    public boolean hasQuickReplies() {
        return quickReplies;
    }

    @JsonCreator
    public static MessageType fromCode(String code) {
        if (code == null || code.isBlank()) return GENERIC;
        for (MessageType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim()) || type.name().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + code);
    }
}
