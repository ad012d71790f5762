package com.ai.clinicbot.conversation;

import com.ai.clinicbot.component.BotMessages;
import com.ai.clinicbot.conversation.context.BookingContext;
import com.ai.clinicbot.conversation.context.BookingContext.DoctorOption;
import com.ai.clinicbot.conversation.context.RescheduleContext.AppointmentOption;
import com.ai.clinicbot.entity.LineDoctor;
import com.ai.clinicbot.entity.Patient;
import com.ai.clinicbot.repository.LineDoctorRepository;
import com.ai.clinicbot.service.AppointmentBookingService;
import com.ai.clinicbot.service.AppointmentBookingService.BookingRequest;
import com.ai.clinicbot.service.AppointmentBookingService.BookingResult;
import com.ai.clinicbot.service.PatientService;
import com.ai.clinicbot.service.SlotAvailabilityService;
import com.ai.clinicbot.service.YesNoClassifier;
import com.ai.clinicbot.utils.AppointmentFormats;
import com.ai.clinicbot.utils.YesNoResult;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Doctor, week, day and hour selection followed by confirmation. Used for new bookings
 * and, with {@link BookingContext#isReschedule()}, for moving an existing appointment.
 */
@Component
public class BookingFlow {

    private static final Logger log = LoggerFactory.getLogger(BookingFlow.class);
    private static final int WEEKS_AHEAD = 2;
    private static final int DEFAULT_DURATION_MINUTES = 60;
    private static final int CONFIRM = 0;
    private static final int CHANGE_TIME = 1;
    private static final int ABORT = 2;

    private final LineDoctorRepository lineDoctorRepository;
    private final SlotAvailabilityService slotAvailabilityService;
    private final AppointmentBookingService bookingService;
    private final PatientService patientService;
    private final YesNoClassifier yesNoClassifier;
    private final MenuFlow menuFlow;
    private final BotMessages messages;
    private final Clock clock;
    private final int hourPageSize;

    public BookingFlow(LineDoctorRepository lineDoctorRepository,
                       SlotAvailabilityService slotAvailabilityService,
                       AppointmentBookingService bookingService,
                       PatientService patientService,
                       YesNoClassifier yesNoClassifier,
                       MenuFlow menuFlow,
                       BotMessages messages,
                       Clock clock,
                       @Value("${clinicbot.bot.hour-page-size:8}") int hourPageSize) {
        this.lineDoctorRepository = lineDoctorRepository;
        this.slotAvailabilityService = slotAvailabilityService;
        this.bookingService = bookingService;
        this.patientService = patientService;
        this.yesNoClassifier = yesNoClassifier;
        this.menuFlow = menuFlow;
        this.messages = messages;
        this.clock = clock;
        this.hourPageSize = hourPageSize;
    }

    public BotResponse start(Turn turn) {
        BookingContext booking = turn.context().startBooking();
        List<DoctorOption> doctors = lineDoctorRepository.findByLineIdOrderByDisplayOrderAsc(turn.lineId()).stream()
                .map(LineDoctor::getDoctor)
                .filter(d -> d != null && d.isActive())
                .map(d -> new DoctorOption(d.getId(), d.displayName(), d.getCalendarId()))
                .toList();
        if (doctors.isEmpty()) {
            log.warn("Line {} has no doctors assigned", turn.lineId());
            return menuFlow.handoff(turn, messages.noDoctors());
        }
        booking.setDoctorOptions(new ArrayList<>(doctors));
        if (doctors.size() == 1) {
            booking.selectDoctor(doctors.get(0));
            return offerWeeks(turn, booking);
        }
        return BotResponse.ask(messages.chooseDoctor(), doctorNames(booking), ConversationState.SELECT_DOCTOR);
    }

    /** Re-enters week selection for an existing appointment's doctor and duration. */
    public BotResponse startReschedule(Turn turn, AppointmentOption appointment) {
        BookingContext booking = turn.context().startBooking();
        booking.selectDoctor(new DoctorOption(appointment.doctorId(), appointment.doctorName(), appointment.calendarId()));
        booking.setDurationMinutes(appointment.durationMinutes());
        booking.setReschedule(true);
        booking.setRescheduleAppointmentId(appointment.id());
        return offerWeeks(turn, booking);
    }

    public BotResponse selectDoctor(Turn turn) {
        BookingContext booking = booking(turn);
        if (booking == null) return start(turn);
        List<String> names = doctorNames(booking);
        int choice = Choices.pick(turn.input(), names);
        if (choice == Choices.NONE) {
            return BotResponse.ask(messages.invalidOption(), names, ConversationState.SELECT_DOCTOR);
        }
        booking.selectDoctor(booking.getDoctorOptions().get(choice));
        return offerWeeks(turn, booking);
    }

    public BotResponse selectWeek(Turn turn) {
        BookingContext booking = booking(turn);
        if (booking == null) return start(turn);
        List<String> labels = booking.getWeekStarts().stream().map(AppointmentFormats::weekLabel).toList();
        int choice = Choices.pick(turn.input(), labels);
        if (choice == Choices.NONE) {
            return BotResponse.ask(messages.invalidOption(), labels, ConversationState.SELECT_WEEK);
        }
        booking.setWeekStart(booking.getWeekStarts().get(choice));
        return offerDays(turn, booking);
    }

    public BotResponse selectDay(Turn turn) {
        BookingContext booking = booking(turn);
        if (booking == null) return start(turn);
        List<String> labels = booking.getDays().stream().map(AppointmentFormats::dayLabel).toList();
        int choice = Choices.pick(turn.input(), labels);
        if (choice == Choices.NONE) {
            return BotResponse.ask(messages.invalidOption(), labels, ConversationState.SELECT_DAY);
        }
        booking.setDate(booking.getDays().get(choice));
        return offerHours(turn, booking, null);
    }

    public BotResponse selectHour(Turn turn) {
        BookingContext booking = booking(turn);
        if (booking == null) return start(turn);
        List<LocalTime> page = currentPage(booking);
        List<String> options = hourOptions(booking, page);
        int choice = Choices.pick(turn.input(), options);
        if (choice == Choices.NONE) {
            return BotResponse.ask(messages.invalidOption(), options, ConversationState.SELECT_HOUR);
        }
        if (choice == page.size()) {
            booking.setHourPage(booking.getHourPage() + 1);
            return hourPage(booking, messages.chooseHour(AppointmentFormats.dayLabel(booking.getDate())));
        }
        booking.setTime(page.get(choice));
        return confirmPrompt(booking);
    }

    public BotResponse confirm(Turn turn) {
        BookingContext booking = booking(turn);
        if (booking == null || booking.getTime() == null) return start(turn);
        List<String> options = messages.confirmOptions();
        int choice = Choices.pick(turn.input(), options);
        if (choice == Choices.NONE) {
            YesNoResult yesNo = yesNoClassifier.classify(turn.input());
            if (yesNo == YesNoResult.YES) choice = CONFIRM;
            else if (yesNo == YesNoResult.NO) choice = ABORT;
        }
        switch (choice) {
            case CONFIRM:
                return commit(turn, booking);
            case CHANGE_TIME:
                return offerHours(turn, booking, null);
            case ABORT:
                return menuFlow.menu(turn, messages.bookingAborted());
            default:
                return confirmPrompt(booking);
        }
    }

    /** Collects a name for a phone with no patient record, then books. */
    public BotResponse askName(Turn turn) {
        BookingContext booking = booking(turn);
        if (booking == null || booking.getTime() == null) return start(turn);
        String name = StringUtils.normalizeSpace(turn.input());
        if (name.length() < 2 || StringUtils.isNumeric(name.replace(" ", ""))) {
            return BotResponse.ask(messages.askNameAgain(), ConversationState.ASK_NAME);
        }
        Patient patient = patientService.createMinimal(name, turn.patientPhone(), turn.organizationId());
        return book(turn, booking, patient);
    }

    private BotResponse commit(Turn turn, BookingContext booking) {
        if (booking.isReschedule()) {
            BookingResult result = bookingService.reschedule(
                    booking.getRescheduleAppointmentId(), booking.getDate(), booking.getTime());
            return outcome(turn, booking, result);
        }
        Optional<Patient> patient = patientService.findByPhone(turn.patientPhone(), turn.organizationId());
        if (patient.isEmpty()) {
            return BotResponse.ask(messages.askName(), ConversationState.ASK_NAME);
        }
        return book(turn, booking, patient.get());
    }

    private BotResponse book(Turn turn, BookingContext booking, Patient patient) {
        BookingResult result = bookingService.book(new BookingRequest(
                booking.getDoctorId(), patient.getId(), booking.getDate(), booking.getTime(),
                booking.getDurationMinutes(), turn.organizationId(), "Agendada por WhatsApp"));
        return outcome(turn, booking, result);
    }

    private BotResponse outcome(Turn turn, BookingContext booking, BookingResult result) {
        String when = AppointmentFormats.dateTime(booking.getDate(), booking.getTime());
        switch (result.outcome()) {
            case SUCCESS:
                log.info("Bot {} appointment {} for line {}",
                        booking.isReschedule() ? "rescheduled" : "booked", result.appointment().getId(), turn.lineId());
                return BotResponse.finish(booking.isReschedule()
                        ? messages.rescheduleConfirmed(booking.getDoctorName(), when)
                        : messages.bookingConfirmed(booking.getDoctorName(), when), ConversationState.COMPLETED);
            case CONFLICT:
                log.info("Slot {} taken before confirmation, refreshing hours", when);
                return offerHours(turn, booking, messages.slotTaken());
            default:
                log.warn("Booking failed for line {}: {}", turn.lineId(), result.message());
                return menuFlow.handoff(turn, messages.bookingFailed());
        }
    }

    private BotResponse offerWeeks(Turn turn, BookingContext booking) {
        if (booking.getDurationMinutes() <= 0) {
            Integer lineDefault = turn.line() != null ? turn.line().getDefaultDurationMinutes() : null;
            booking.setDurationMinutes(lineDefault != null && lineDefault > 0 ? lineDefault : DEFAULT_DURATION_MINUTES);
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        List<LocalDate> weeks = new ArrayList<>();
        for (int i = 0; i < WEEKS_AHEAD; i++) {
            LocalDate weekStart = monday.plusWeeks(i);
            LocalDate from = weekStart.isBefore(today) ? today : weekStart;
            if (slotAvailabilityService.hasAvailability(booking.getDoctorId(), from, weekStart.plusDays(6),
                    booking.getDurationMinutes())) {
                weeks.add(weekStart);
            }
        }
        if (weeks.isEmpty()) {
            return menuFlow.handoff(turn, messages.noAvailability());
        }
        booking.setWeekStarts(weeks);
        return BotResponse.ask(messages.chooseWeek(booking.getDoctorName()),
                weeks.stream().map(AppointmentFormats::weekLabel).toList(), ConversationState.SELECT_WEEK);
    }

    private BotResponse offerDays(Turn turn, BookingContext booking) {
        LocalDate today = LocalDate.now(clock);
        LocalDate from = booking.getWeekStart().isBefore(today) ? today : booking.getWeekStart();
        List<LocalDate> days = slotAvailabilityService.availableDays(
                booking.getDoctorId(), from, booking.getWeekStart().plusDays(6), booking.getDurationMinutes());
        if (days.isEmpty()) {
            return offerWeeks(turn, booking);
        }
        booking.setDays(days);
        return BotResponse.ask(messages.chooseDay(),
                days.stream().map(AppointmentFormats::dayLabel).toList(), ConversationState.SELECT_DAY);
    }

    private BotResponse offerHours(Turn turn, BookingContext booking, String prefix) {
        booking.clearHours();
        List<LocalTime> hours = slotAvailabilityService.bookableSlots(
                booking.getDoctorId(), booking.getDate(), booking.getDurationMinutes());
        if (hours.isEmpty()) {
            return offerDays(turn, booking);
        }
        booking.setHours(new ArrayList<>(hours));
        String title = messages.chooseHour(AppointmentFormats.dayLabel(booking.getDate()));
        return hourPage(booking, prefix == null ? title : prefix + "\n" + title);
    }

    private BotResponse hourPage(BookingContext booking, String message) {
        return BotResponse.ask(message, hourOptions(booking, currentPage(booking)), ConversationState.SELECT_HOUR);
    }

    private List<LocalTime> currentPage(BookingContext booking) {
        List<LocalTime> hours = booking.getHours();
        int from = Math.min(booking.getHourPage() * hourPageSize, hours.size());
        return hours.subList(from, Math.min(from + hourPageSize, hours.size()));
    }

    private List<String> hourOptions(BookingContext booking, List<LocalTime> page) {
        List<String> options = new ArrayList<>(page.stream().map(AppointmentFormats::time).toList());
        if ((booking.getHourPage() + 1) * hourPageSize < booking.getHours().size()) {
            options.add(messages.moreHoursOption());
        }
        return options;
    }

    private BotResponse confirmPrompt(BookingContext booking) {
        String when = AppointmentFormats.dayName(booking.getDate().getDayOfWeek()) + " "
                + AppointmentFormats.dateTime(booking.getDate(), booking.getTime());
        String message = booking.isReschedule()
                ? messages.confirmReschedule(booking.getDoctorName(), when)
                : messages.confirmBooking(booking.getDoctorName(), when);
        return BotResponse.ask(message, messages.confirmOptions(), ConversationState.CONFIRM);
    }

    private static List<String> doctorNames(BookingContext booking) {
        return booking.getDoctorOptions().stream().map(DoctorOption::name).toList();
    }

    private static BookingContext booking(Turn turn) {
        return turn.context().booking();
    }
}
