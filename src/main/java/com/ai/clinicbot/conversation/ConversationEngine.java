package com.ai.clinicbot.conversation;

import com.ai.clinicbot.component.BotMessages;
import com.ai.clinicbot.conversation.context.ConversationContext;
import com.ai.clinicbot.entity.BotSession;
import com.ai.clinicbot.entity.ChannelLine;
import com.ai.clinicbot.repository.ChannelLineRepository;
import com.ai.clinicbot.service.BotSessionService;
import com.ai.clinicbot.utils.PhoneNumbers;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Single entry for chat turns: loads or creates the session, applies expiry and restart
 * commands, dispatches on the stored state and persists the outcome.
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);
    private static final int MAX_INVALID_ATTEMPTS = 3;

    private final BotSessionService sessionService;
    private final ChannelLineRepository lineRepository;
    private final MenuFlow menuFlow;
    private final BookingFlow bookingFlow;
    private final RescheduleFlow rescheduleFlow;
    private final FaqFlow faqFlow;
    private final BotMessages messages;
    private final Set<String> restartCommands;

    public ConversationEngine(BotSessionService sessionService,
                              ChannelLineRepository lineRepository,
                              MenuFlow menuFlow,
                              BookingFlow bookingFlow,
                              RescheduleFlow rescheduleFlow,
                              FaqFlow faqFlow,
                              BotMessages messages,
                              @Value("${clinicbot.bot.restart-commands:0,reiniciar,restart,inicio}") String[] restartCommands) {
        this.sessionService = sessionService;
        this.lineRepository = lineRepository;
        this.menuFlow = menuFlow;
        this.bookingFlow = bookingFlow;
        this.rescheduleFlow = rescheduleFlow;
        this.faqFlow = faqFlow;
        this.messages = messages;
        this.restartCommands = Arrays.stream(restartCommands)
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toSet());
    }

    public BotResponse handle(BotRequest request) {
        if (request.lineId() == null || StringUtils.isBlank(request.patientPhone())) {
            throw new IllegalArgumentException("lineId and patientPhone are required");
        }
        ChannelLine line = lineRepository.findById(request.lineId()).orElse(null);
        UUID organizationId = request.organizationId() != null ? request.organizationId()
                : line != null ? line.getOrganizationId() : null;
        String phone = PhoneNumbers.normalizeToE164(request.patientPhone());
        String input = StringUtils.trimToEmpty(request.messageText());

        BotSession session = sessionService.load(request.lineId(), phone)
                .orElseGet(() -> sessionService.create(request.lineId(), phone, organizationId));
        if (sessionService.isExpired(session)) {
            log.info("Session {} expired, starting over", session.getId());
            session = sessionService.reset(session.getId());
        } else if (isRestartCommand(input)) {
            log.info("Session {} restarted by patient", session.getId());
            session = sessionService.reset(session.getId());
        } else if (session.getState() == ConversationState.COMPLETED) {
            session = sessionService.reset(session.getId());
        }

        ConversationContext context = session.getContext() != null ? session.getContext() : new ConversationContext();
        Turn turn = new Turn(session, line, organizationId, input, context);
        BotResponse response;
        try {
            response = dispatch(session.getState(), turn);
        } catch (RuntimeException e) {
            log.error("Bot turn failed for session {} in state {}", session.getId(), session.getState(), e);
            response = BotResponse.finish(messages.genericError(), ConversationState.HANDOFF_SECRETARY);
        }
        sessionService.update(session.getId(), response.getNextState(), context, response.isSessionComplete());
        log.debug("Session {} {} -> {}", session.getId(), session.getState(), response.getNextState());
        return response;
    }

    private BotResponse dispatch(ConversationState state, Turn turn) {
        return switch (state) {
            case GREETING, COMPLETED -> menuFlow.greeting(turn);
            case MAIN_MENU -> mainMenu(turn);
            case FAQ_SEARCH -> faqFlow.handle(turn);
            case SELECT_DOCTOR -> bookingFlow.selectDoctor(turn);
            case SELECT_WEEK -> bookingFlow.selectWeek(turn);
            case SELECT_DAY -> bookingFlow.selectDay(turn);
            case SELECT_HOUR -> bookingFlow.selectHour(turn);
            case CONFIRM -> bookingFlow.confirm(turn);
            case ASK_NAME -> bookingFlow.askName(turn);
            case RESCHEDULE_LIST -> rescheduleFlow.selectAppointment(turn);
            case CANCEL_CONFIRM -> rescheduleFlow.cancelConfirm(turn);
            case HANDOFF_SECRETARY -> menuFlow.handoff(turn);
        };
    }

    private BotResponse mainMenu(Turn turn) {
        String input = Choices.normalize(turn.input());
        if (input.equals("1") || (input.contains("agendar") && !input.contains("reagendar"))) {
            turn.context().resetInvalidAttempts();
            return bookingFlow.start(turn);
        }
        if (input.equals("2") || input.contains("reagendar") || input.contains("cancelar")) {
            turn.context().resetInvalidAttempts();
            return rescheduleFlow.start(turn);
        }
        if (input.equals("3") || input.contains("faq") || input.contains("pregunta")) {
            turn.context().resetInvalidAttempts();
            return faqFlow.start(turn);
        }
        if (input.equals("4") || input.contains("secretar")) {
            return menuFlow.handoff(turn);
        }
        if (input.contains("menu") || input.contains("volver")) {
            return menuFlow.menu(turn, messages.menuReturn());
        }
        int attempts = turn.context().incrementInvalidAttempts();
        if (attempts >= MAX_INVALID_ATTEMPTS) {
            log.info("Session {} reached {} invalid menu inputs, handing off", turn.session().getId(), attempts);
            return menuFlow.handoff(turn);
        }
        return menuFlow.retryMenu();
    }

    private boolean isRestartCommand(String input) {
        return restartCommands.contains(input.toLowerCase(Locale.ROOT));
    }
}
