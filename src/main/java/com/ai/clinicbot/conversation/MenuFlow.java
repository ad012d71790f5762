package com.ai.clinicbot.conversation;

import com.ai.clinicbot.component.BotMessages;
import com.ai.clinicbot.service.StaffNotificationService;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Greeting, main menu presentation and the secretary handoff every other flow falls back to.
 */
@Component
public class MenuFlow {

    private final BotMessages messages;
    private final StaffNotificationService staffNotificationService;

    public MenuFlow(BotMessages messages, StaffNotificationService staffNotificationService) {
        this.messages = messages;
        this.staffNotificationService = staffNotificationService;
    }

    public BotResponse greeting(Turn turn) {
        String greeting = turn.line() != null && StringUtils.isNotBlank(turn.line().getBotGreeting())
                ? turn.line().getBotGreeting()
                : messages.defaultGreeting();
        return menu(turn, greeting);
    }

    public BotResponse menu(Turn turn, String message) {
        turn.context().clearFlow();
        turn.context().resetInvalidAttempts();
        return BotResponse.ask(message, BotMessages.MAIN_MENU_OPTIONS, ConversationState.MAIN_MENU);
    }

    public BotResponse retryMenu() {
        return BotResponse.ask(messages.menuRetry(), BotMessages.MAIN_MENU_OPTIONS, ConversationState.MAIN_MENU);
    }

    public BotResponse handoff(Turn turn) {
        return handoff(turn, messages.handoff());
    }

    /** Terminal acknowledgement; staff are notified out of band. */
    public BotResponse handoff(Turn turn, String message) {
        staffNotificationService.notifyHandoff(turn.organizationId(), turn.lineId(), turn.patientPhone());
        return BotResponse.finish(message, ConversationState.HANDOFF_SECRETARY);
    }
}
