package com.ai.clinicbot.conversation.context;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Flow-specific part of the session context. Exactly one flow is active at a time;
 * the JSON carries a {@code kind} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BookingContext.class, name = "booking"),
        @JsonSubTypes.Type(value = RescheduleContext.class, name = "reschedule"),
        @JsonSubTypes.Type(value = FaqContext.class, name = "faq")
})
public abstract class FlowContext {
}
