package com.ai.clinicbot.conversation.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed session context persisted as JSON on the session row.
 * {@code metadata} is for optional, free-form annotations only; flow data lives in {@link #flow}.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationContext {

    private int invalidAttempts;
    private FlowContext flow;
    private Map<String, String> metadata = new LinkedHashMap<>();

    @JsonIgnore
    public BookingContext booking() {
        return flow instanceof BookingContext ? (BookingContext) flow : null;
    }

    @JsonIgnore
    public RescheduleContext reschedule() {
        return flow instanceof RescheduleContext ? (RescheduleContext) flow : null;
    }

    @JsonIgnore
    public FaqContext faq() {
        return flow instanceof FaqContext ? (FaqContext) flow : null;
    }

    public BookingContext startBooking() {
        BookingContext booking = new BookingContext();
        this.flow = booking;
        return booking;
    }

    public RescheduleContext startReschedule() {
        RescheduleContext reschedule = new RescheduleContext();
        this.flow = reschedule;
        return reschedule;
    }

    public FaqContext startFaq() {
        FaqContext faq = new FaqContext();
        this.flow = faq;
        return faq;
    }

    public void clearFlow() {
        this.flow = null;
    }

    public int incrementInvalidAttempts() {
        return ++invalidAttempts;
    }

    public void resetInvalidAttempts() {
        this.invalidAttempts = 0;
    }
}
