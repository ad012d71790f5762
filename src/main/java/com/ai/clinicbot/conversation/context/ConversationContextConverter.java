package com.ai.clinicbot.conversation.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON column mapping for {@link ConversationContext}. An unreadable context is replaced
 * by an empty one so the conversation restarts instead of failing every turn.
 */
@Converter
public class ConversationContextConverter implements AttributeConverter<ConversationContext, String> {

    private static final Logger log = LoggerFactory.getLogger(ConversationContextConverter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Detached copy. Assigning a fresh instance to the entity makes Hibernate see the
     * context as changed even when it was mutated in place.
     */
    public static ConversationContext copy(ConversationContext context) {
        ConversationContextConverter converter = new ConversationContextConverter();
        return converter.convertToEntityAttribute(converter.convertToDatabaseColumn(context));
    }

    @Override
    public String convertToDatabaseColumn(ConversationContext context) {
        if (context == null) return null;
        try {
            return MAPPER.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize conversation context", e);
        }
    }

    @Override
    public ConversationContext convertToEntityAttribute(String json) {
        if (StringUtils.isBlank(json)) return new ConversationContext();
        try {
            return MAPPER.readValue(json, ConversationContext.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable conversation context: {}", e.getOriginalMessage());
            return new ConversationContext();
        }
    }
}
