package com.ai.clinicbot.conversation;

import com.ai.clinicbot.component.BotMessages;
import com.ai.clinicbot.conversation.context.FaqContext;
import com.ai.clinicbot.conversation.context.FaqContext.FaqStep;
import com.ai.clinicbot.entity.Doctor;
import com.ai.clinicbot.entity.LineDoctor;
import com.ai.clinicbot.repository.LineDoctorRepository;
import com.ai.clinicbot.service.FaqMatcherService;
import com.ai.clinicbot.service.FaqMatcherService.FaqMatch;
import com.ai.clinicbot.service.YesNoClassifier;
import com.ai.clinicbot.utils.YesNoResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Free-text FAQ lookup. Every reply offers a way forward: another question, the menu,
 * or the secretary.
 */
@Component
public class FaqFlow {

    private static final int SHORT_REPLY_LENGTH = 20;

    private final FaqMatcherService faqMatcherService;
    private final LineDoctorRepository lineDoctorRepository;
    private final YesNoClassifier yesNoClassifier;
    private final MenuFlow menuFlow;
    private final BotMessages messages;

    public FaqFlow(FaqMatcherService faqMatcherService,
                   LineDoctorRepository lineDoctorRepository,
                   YesNoClassifier yesNoClassifier,
                   MenuFlow menuFlow,
                   BotMessages messages) {
        this.faqMatcherService = faqMatcherService;
        this.lineDoctorRepository = lineDoctorRepository;
        this.yesNoClassifier = yesNoClassifier;
        this.menuFlow = menuFlow;
        this.messages = messages;
    }

    public BotResponse start(Turn turn) {
        FaqContext faq = turn.context().startFaq();
        // Lines dedicated to one doctor answer with that doctor's entries first
        List<LineDoctor> doctors = lineDoctorRepository.findByLineIdOrderByDisplayOrderAsc(turn.lineId());
        if (doctors.size() == 1 && doctors.get(0).getDoctor() != null) {
            Doctor doctor = doctors.get(0).getDoctor();
            faq.setDoctorId(doctor.getId());
            faq.setClinicId(doctor.getClinicId());
        }
        return BotResponse.ask(messages.askFaq(), ConversationState.FAQ_SEARCH);
    }

    public BotResponse handle(Turn turn) {
        FaqContext faq = turn.context().faq();
        if (faq == null) {
            faq = turn.context().startFaq();
        }
        return switch (faq.getStep()) {
            case QUERY -> search(turn, faq);
            case AFTER_ANSWER -> afterAnswer(turn, faq);
            case AFTER_MISS -> afterMiss(turn, faq);
        };
    }

    private BotResponse afterAnswer(Turn turn, FaqContext faq) {
        int choice = Choices.pick(turn.input(), messages.faqAnswerOptions());
        if (choice == 0) return menuFlow.menu(turn, messages.menuReturn());
        if (choice == 1) {
            faq.setStep(FaqStep.QUERY);
            return BotResponse.ask(messages.faqNextQuestion(), ConversationState.FAQ_SEARCH);
        }
        return search(turn, faq);
    }

    private BotResponse afterMiss(Turn turn, FaqContext faq) {
        int choice = Choices.pick(turn.input(), messages.faqNotFoundOptions());
        YesNoResult yesNo = turn.input().length() <= SHORT_REPLY_LENGTH
                ? yesNoClassifier.classify(turn.input())
                : YesNoResult.UNKNOWN;
        if (choice == 0 || (choice == Choices.NONE && yesNo == YesNoResult.YES)) {
            return menuFlow.handoff(turn);
        }
        if (choice == 1 || yesNo == YesNoResult.NO) {
            return menuFlow.menu(turn, messages.menuReturn());
        }
        return search(turn, faq);
    }

    private BotResponse search(Turn turn, FaqContext faq) {
        Optional<FaqMatch> match = faqMatcherService.search(
                turn.input(), turn.organizationId(), faq.getDoctorId(), faq.getClinicId());
        if (match.isPresent()) {
            faq.setStep(FaqStep.AFTER_ANSWER);
            return BotResponse.ask(messages.faqAnswer(match.get().entry().getQuestion(), match.get().entry().getAnswer()),
                    messages.faqAnswerOptions(), ConversationState.FAQ_SEARCH);
        }
        faq.setStep(FaqStep.AFTER_MISS);
        return BotResponse.ask(messages.faqNotFound(), messages.faqNotFoundOptions(), ConversationState.FAQ_SEARCH);
    }
}
