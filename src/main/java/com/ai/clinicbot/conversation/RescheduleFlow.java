package com.ai.clinicbot.conversation;

import com.ai.clinicbot.component.BotMessages;
import com.ai.clinicbot.conversation.context.RescheduleContext;
import com.ai.clinicbot.conversation.context.RescheduleContext.AppointmentOption;
import com.ai.clinicbot.conversation.context.RescheduleContext.CancelConfirmPhase;
import com.ai.clinicbot.entity.Appointment;
import com.ai.clinicbot.entity.Doctor;
import com.ai.clinicbot.entity.Patient;
import com.ai.clinicbot.repository.DoctorRepository;
import com.ai.clinicbot.service.AppointmentBookingService;
import com.ai.clinicbot.service.AppointmentBookingService.BookingResult;
import com.ai.clinicbot.service.PatientService;
import com.ai.clinicbot.service.YesNoClassifier;
import com.ai.clinicbot.utils.AppointmentFormats;
import com.ai.clinicbot.utils.YesNoResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Lists the patient's upcoming appointments and lets them reschedule or cancel one.
 * Cancelling takes two replies: choosing the action, then an explicit yes.
 */
@Component
public class RescheduleFlow {

    private static final Logger log = LoggerFactory.getLogger(RescheduleFlow.class);
    private static final int ACTION_RESCHEDULE = 0;
    private static final int ACTION_CANCEL = 1;
    private static final int ACTION_BACK = 2;

    private final PatientService patientService;
    private final AppointmentBookingService bookingService;
    private final DoctorRepository doctorRepository;
    private final BookingFlow bookingFlow;
    private final MenuFlow menuFlow;
    private final YesNoClassifier yesNoClassifier;
    private final BotMessages messages;

    public RescheduleFlow(PatientService patientService,
                          AppointmentBookingService bookingService,
                          DoctorRepository doctorRepository,
                          BookingFlow bookingFlow,
                          MenuFlow menuFlow,
                          YesNoClassifier yesNoClassifier,
                          BotMessages messages) {
        this.patientService = patientService;
        this.bookingService = bookingService;
        this.doctorRepository = doctorRepository;
        this.bookingFlow = bookingFlow;
        this.menuFlow = menuFlow;
        this.yesNoClassifier = yesNoClassifier;
        this.messages = messages;
    }

    public BotResponse start(Turn turn) {
        RescheduleContext reschedule = turn.context().startReschedule();
        List<Patient> patients = patientService.findAllByPhone(turn.patientPhone(), turn.organizationId());
        if (patients.isEmpty()) {
            return menuFlow.handoff(turn, messages.patientNotFound());
        }
        reschedule.setPatientId(patients.get(0).getId());
        reschedule.setPatientName(patients.get(0).getName());

        List<UUID> patientIds = patients.stream().map(Patient::getId).toList();
        List<AppointmentOption> options = new ArrayList<>();
        for (Appointment a : bookingService.upcomingForPatient(patientIds)) {
            String doctorName = doctorRepository.findById(a.getDoctorId()).map(Doctor::displayName).orElse("");
            options.add(new AppointmentOption(a.getId(), a.getDoctorId(), doctorName, a.getCalendarId(),
                    a.getDate(), a.getTime(), a.getDurationMinutes()));
        }
        if (options.isEmpty()) {
            return menuFlow.menu(turn, messages.noUpcomingAppointments() + "\n" + messages.menuReturn());
        }
        reschedule.setAppointments(options);
        if (options.size() == 1) {
            reschedule.setSelectedAppointmentId(options.get(0).id());
            return chooseAction(reschedule);
        }
        return BotResponse.ask(messages.chooseAppointment(), summaries(reschedule), ConversationState.RESCHEDULE_LIST);
    }

    public BotResponse selectAppointment(Turn turn) {
        RescheduleContext reschedule = turn.context().reschedule();
        if (reschedule == null) return start(turn);
        List<String> summaries = summaries(reschedule);
        int choice = Choices.pick(turn.input(), summaries);
        if (choice == Choices.NONE) {
            return BotResponse.ask(messages.invalidOption(), summaries, ConversationState.RESCHEDULE_LIST);
        }
        reschedule.setSelectedAppointmentId(reschedule.getAppointments().get(choice).id());
        return chooseAction(reschedule);
    }

    public BotResponse cancelConfirm(Turn turn) {
        RescheduleContext reschedule = turn.context().reschedule();
        if (reschedule == null || reschedule.selected().isEmpty()) return start(turn);
        CancelConfirmPhase phase = reschedule.getPhase() == null ? CancelConfirmPhase.CHOOSE_ACTION : reschedule.getPhase();
        return switch (phase) {
            case CHOOSE_ACTION -> handleAction(turn, reschedule);
            case CONFIRM_CANCEL -> handleCancelDecision(turn, reschedule);
        };
    }

    private BotResponse handleAction(Turn turn, RescheduleContext reschedule) {
        AppointmentOption selected = reschedule.selected().orElseThrow();
        int choice = Choices.pick(turn.input(), messages.appointmentActionOptions());
        if (choice == Choices.NONE) {
            String normalized = Choices.normalize(turn.input());
            if (normalized.contains("reagend") || normalized.contains("cambiar")) choice = ACTION_RESCHEDULE;
            else if (normalized.contains("cancel")) choice = ACTION_CANCEL;
            else if (normalized.contains("menu") || normalized.contains("volver")) choice = ACTION_BACK;
        }
        switch (choice) {
            case ACTION_RESCHEDULE:
                return bookingFlow.startReschedule(turn, selected);
            case ACTION_CANCEL:
                reschedule.setPhase(CancelConfirmPhase.CONFIRM_CANCEL);
                return BotResponse.ask(messages.confirmCancel(summary(selected)), messages.confirmCancelOptions(),
                        ConversationState.CANCEL_CONFIRM);
            case ACTION_BACK:
                return menuFlow.menu(turn, messages.menuReturn());
            default:
                return chooseAction(reschedule);
        }
    }

    /** Only "1" or an explicit yes cancels. Anything unclear asks again. */
    private BotResponse handleCancelDecision(Turn turn, RescheduleContext reschedule) {
        AppointmentOption selected = reschedule.selected().orElseThrow();
        String input = Choices.normalize(turn.input());
        YesNoResult decision = "1".equals(input) ? YesNoResult.YES
                : "2".equals(input) ? YesNoResult.NO
                : yesNoClassifier.classify(turn.input());
        if (decision == YesNoResult.NO) {
            return menuFlow.menu(turn, messages.cancelKept());
        }
        if (decision != YesNoResult.YES) {
            return BotResponse.ask(messages.confirmCancel(summary(selected)), messages.confirmCancelOptions(),
                    ConversationState.CANCEL_CONFIRM);
        }
        BookingResult result = bookingService.cancel(selected.id(), "Cancelada por el paciente vía WhatsApp");
        switch (result.outcome()) {
            case SUCCESS:
            case CONFLICT:
                log.info("Patient cancelled appointment {} via bot", selected.id());
                return BotResponse.finish(messages.cancelConfirmed(), ConversationState.COMPLETED);
            default:
                return menuFlow.handoff(turn, messages.bookingFailed());
        }
    }

    private BotResponse chooseAction(RescheduleContext reschedule) {
        reschedule.setPhase(CancelConfirmPhase.CHOOSE_ACTION);
        AppointmentOption selected = reschedule.selected().orElseThrow();
        return BotResponse.ask(messages.appointmentAction(summary(selected)), messages.appointmentActionOptions(),
                ConversationState.CANCEL_CONFIRM);
    }

    private static List<String> summaries(RescheduleContext reschedule) {
        return reschedule.getAppointments().stream().map(RescheduleFlow::summary).toList();
    }

    private static String summary(AppointmentOption a) {
        return AppointmentFormats.dayName(a.date().getDayOfWeek()) + " "
                + AppointmentFormats.dateTime(a.date(), a.time())
                + (a.doctorName().isEmpty() ? "" : " con " + a.doctorName());
    }
}
