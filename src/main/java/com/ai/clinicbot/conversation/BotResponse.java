package com.ai.clinicbot.conversation;

import java.util.Collections;
import java.util.List;

/**
 * Reply computed for one turn. The only thing a state handler returns; the engine
 * persists {@link #getNextState()} and the mutated context.
 */
public final class BotResponse {

    private final String message;
    private final List<String> options;
    private final boolean requiresInput;
    private final ConversationState nextState;
    private final boolean sessionComplete;

    private BotResponse(String message, List<String> options, boolean requiresInput,
                        ConversationState nextState, boolean sessionComplete) {
        this.message = message;
        this.options = options == null ? Collections.emptyList() : List.copyOf(options);
        this.requiresInput = requiresInput;
        this.nextState = nextState;
        this.sessionComplete = sessionComplete;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getOptions() {
        return options;
    }

    public boolean isRequiresInput() {
        return requiresInput;
    }

    public ConversationState getNextState() {
        return nextState;
    }

    public boolean isSessionComplete() {
        return sessionComplete;
    }

    public static BotResponse ask(String message, List<String> options, ConversationState nextState) {
        return new BotResponse(message, options, true, nextState, false);
    }

    public static BotResponse ask(String message, ConversationState nextState) {
        return new BotResponse(message, null, true, nextState, false);
    }

    public static BotResponse finish(String message, ConversationState nextState) {
        return new BotResponse(message, null, false, nextState, true);
    }

    /** Message with the options rendered as "1. option" lines, as sent over WhatsApp. */
    public String render() {
        if (options.isEmpty()) return message;
        StringBuilder sb = new StringBuilder(message == null ? "" : message);
        for (int i = 0; i < options.size(); i++) {
            sb.append(sb.length() > 0 ? "\n" : "").append(i + 1).append(". ").append(options.get(i));
        }
        return sb.toString();
    }
}
