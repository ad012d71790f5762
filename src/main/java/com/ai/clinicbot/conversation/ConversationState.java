package com.ai.clinicbot.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * State machine for the WhatsApp scheduling conversation.
 */
public enum ConversationState {
    GREETING("greeting"),
    MAIN_MENU("main_menu"),
    FAQ_SEARCH("faq_search"),
    SELECT_DOCTOR("select_doctor"),
    SELECT_WEEK("select_week"),
    SELECT_DAY("select_day"),
    SELECT_HOUR("select_hour"),
    CONFIRM("confirm"),
    ASK_NAME("ask_name"),
    RESCHEDULE_LIST("reschedule_list"),
    CANCEL_CONFIRM("cancel_confirm"),
    HANDOFF_SECRETARY("handoff_secretary"),
    COMPLETED("completed");

    private final String code;

    ConversationState(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ConversationState fromCode(String code) {
        for (ConversationState state : values()) {
            if (state.code.equalsIgnoreCase(code) || state.name().equalsIgnoreCase(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown conversation state: " + code);
    }
}
