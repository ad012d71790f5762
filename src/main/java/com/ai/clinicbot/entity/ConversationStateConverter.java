package com.ai.clinicbot.entity;

import com.ai.clinicbot.conversation.ConversationState;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores states by their wire code (e.g. {@code select_hour}). */
@Converter
public class ConversationStateConverter implements AttributeConverter<ConversationState, String> {

    @Override
    public String convertToDatabaseColumn(ConversationState attribute) {
        return attribute == null ? null : attribute.code();
    }

    @Override
    public ConversationState convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ConversationState.fromCode(dbData);
    }
}
