package com.ai.clinicbot.conversation;

import com.ai.clinicbot.component.BotMessages;
import com.ai.clinicbot.entity.Appointment;
import com.ai.clinicbot.entity.BotSession;
import com.ai.clinicbot.entity.ChannelLine;
import com.ai.clinicbot.entity.Doctor;
import com.ai.clinicbot.entity.FaqEntry;
import com.ai.clinicbot.entity.LineDoctor;
import com.ai.clinicbot.entity.MessagingProviderType;
import com.ai.clinicbot.entity.Organization;
import com.ai.clinicbot.entity.Patient;
import com.ai.clinicbot.entity.ScheduleRule;
import com.ai.clinicbot.messaging.GatewaySendResult;
import com.ai.clinicbot.messaging.MessagingGateway;
import com.ai.clinicbot.repository.AppointmentRepository;
import com.ai.clinicbot.repository.BotSessionRepository;
import com.ai.clinicbot.repository.ChannelLineRepository;
import com.ai.clinicbot.repository.DoctorRepository;
import com.ai.clinicbot.repository.FaqEntryRepository;
import com.ai.clinicbot.repository.LineDoctorRepository;
import com.ai.clinicbot.repository.OrganizationRepository;
import com.ai.clinicbot.repository.PatientRepository;
import com.ai.clinicbot.repository.ScheduleRuleRepository;
import com.ai.clinicbot.service.AppointmentBookingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;

@SpringBootTest
class ConversationEngineTest {

    // Tuesday 2025-01-14, 08:00 in Tegucigalpa
    private static final Instant START = Instant.parse("2025-01-14T14:00:00Z");
    private static final LocalDate WEDNESDAY = LocalDate.of(2025, 1, 15);
    private static final String PHONE = "+50493133496";

    @TestConfiguration
    static class ClockOverride {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START, ZoneId.of("America/Tegucigalpa"));
        }
    }

    static class MutableClock extends Clock {
        private Instant instant;
        private final ZoneId zone;

        MutableClock(Instant instant, ZoneId zone) {
            this.instant = instant;
            this.zone = zone;
        }

        void set(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            this.instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new MutableClock(instant, zone);
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }

    @MockBean
    private MessagingGateway messagingGateway;

    @Autowired
    private ConversationEngine engine;
    @Autowired
    private MutableClock clock;
    @Autowired
    private BotMessages messages;
    @Autowired
    private AppointmentBookingService bookingService;
    @Autowired
    private OrganizationRepository organizationRepository;
    @Autowired
    private ChannelLineRepository lineRepository;
    @Autowired
    private DoctorRepository doctorRepository;
    @Autowired
    private LineDoctorRepository lineDoctorRepository;
    @Autowired
    private ScheduleRuleRepository scheduleRuleRepository;
    @Autowired
    private PatientRepository patientRepository;
    @Autowired
    private AppointmentRepository appointmentRepository;
    @Autowired
    private BotSessionRepository sessionRepository;
    @Autowired
    private FaqEntryRepository faqEntryRepository;

    private Organization organization;
    private ChannelLine line;
    private Doctor doctor;

    @BeforeEach
    void setUp() {
        clock.set(START);
        given(messagingGateway.send(any())).willReturn(GatewaySendResult.builder().ok(true).status("sent").build());

        organization = organizationRepository.save(Organization.builder().name("Clínica Central").build());
        line = lineRepository.save(ChannelLine.builder()
                .organizationId(organization.getId())
                .phoneNumber("+50422223333")
                .provider(MessagingProviderType.META)
                .metaPhoneNumberId("1098765")
                .botEnabled(true)
                .build());
        doctor = doctorRepository.save(Doctor.builder()
                .organizationId(organization.getId())
                .name("Pérez")
                .prefix("Dra.")
                .build());
        lineDoctorRepository.save(LineDoctor.builder().lineId(line.getId()).doctor(doctor).displayOrder(1).build());
        scheduleRuleRepository.save(ScheduleRule.builder()
                .doctorId(doctor.getId())
                .dayOfWeek(3)
                .startTime(LocalTime.of(8, 0))
                .endTime(LocalTime.of(12, 0))
                .build());
    }

    @AfterEach
    void tearDown() {
        sessionRepository.deleteAll();
        faqEntryRepository.deleteAll();
        appointmentRepository.deleteAll();
        patientRepository.deleteAll();
        scheduleRuleRepository.deleteAll();
        lineDoctorRepository.deleteAll();
        doctorRepository.deleteAll();
        lineRepository.deleteAll();
        organizationRepository.deleteAll();
    }

    @Test
    void firstMessageGetsGreetingAndMainMenu() {
        BotResponse response = say("hola");

        assertEquals(ConversationState.MAIN_MENU, response.getNextState());
        assertEquals(messages.defaultGreeting(), response.getMessage());
        assertEquals(BotMessages.MAIN_MENU_OPTIONS, response.getOptions());
        assertTrue(response.isRequiresInput());
    }

    @Test
    void threeInvalidMenuInputsHandOffToSecretary() {
        say("hola");
        assertEquals(ConversationState.MAIN_MENU, say("xyz").getNextState());
        assertEquals(ConversationState.MAIN_MENU, say("abc").getNextState());

        BotResponse response = say("qqq");

        assertEquals(ConversationState.HANDOFF_SECRETARY, response.getNextState());
        assertTrue(response.isSessionComplete());
        assertEquals(ConversationState.COMPLETED, storedState());
    }

    @Test
    void expiredSessionStartsOver() {
        say("hola");
        say("1");
        assertEquals(ConversationState.SELECT_WEEK, storedState());

        clock.advance(Duration.ofMinutes(46));
        BotResponse response = say("1");

        assertEquals(ConversationState.MAIN_MENU, response.getNextState());
        assertEquals(messages.defaultGreeting(), response.getMessage());
    }

    @Test
    void restartCommandReturnsToGreeting() {
        say("hola");
        say("1");

        BotResponse response = say("reiniciar");

        assertEquals(ConversationState.MAIN_MENU, response.getNextState());
        assertEquals(messages.defaultGreeting(), response.getMessage());
    }

    @Test
    void newPatientBooksThroughTheWholeFlow() {
        say("hola");
        BotResponse weeks = say("1");
        assertEquals(ConversationState.SELECT_WEEK, weeks.getNextState());
        assertEquals(2, weeks.getOptions().size());

        BotResponse days = say("1");
        assertEquals(ConversationState.SELECT_DAY, days.getNextState());
        assertEquals(1, days.getOptions().size());

        BotResponse hours = say("1");
        assertEquals(ConversationState.SELECT_HOUR, hours.getNextState());
        assertEquals("8:00 AM", hours.getOptions().get(0));

        assertEquals(ConversationState.CONFIRM, say("1").getNextState());
        assertEquals(ConversationState.ASK_NAME, say("1").getNextState());

        BotResponse done = say("Ana López");

        assertEquals(ConversationState.COMPLETED, done.getNextState());
        assertTrue(done.isSessionComplete());
        List<Appointment> booked = appointmentRepository.findAll();
        assertEquals(1, booked.size());
        assertEquals(WEDNESDAY, booked.get(0).getDate());
        assertEquals(LocalTime.of(8, 0), booked.get(0).getTime());
        Patient patient = patientRepository.findById(booked.get(0).getPatientId()).orElseThrow();
        assertEquals("Ana López", patient.getName());
        assertEquals(PHONE, patient.getPhone());
    }

    @Test
    void cancellingNeedsAnExplicitYes() {
        Patient patient = patientRepository.save(Patient.builder()
                .organizationId(organization.getId())
                .name("Ana López")
                .phone(PHONE)
                .build());
        UUID appointmentId = bookingService.book(new AppointmentBookingService.BookingRequest(
                doctor.getId(), patient.getId(), WEDNESDAY, LocalTime.of(9, 0), 60, organization.getId(), null))
                .appointment().getId();

        say("hola");
        BotResponse actions = say("2");
        assertEquals(ConversationState.CANCEL_CONFIRM, actions.getNextState());
        assertEquals(messages.appointmentActionOptions(), actions.getOptions());

        BotResponse confirm = say("2");
        assertEquals(messages.confirmCancelOptions(), confirm.getOptions());
        assertEquals(Appointment.Status.SCHEDULED, status(appointmentId));

        assertEquals(ConversationState.CANCEL_CONFIRM, say("mmm").getNextState());
        assertEquals(Appointment.Status.SCHEDULED, status(appointmentId));

        BotResponse done = say("1");

        assertTrue(done.isSessionComplete());
        assertEquals(Appointment.Status.CANCELLED, status(appointmentId));
    }

    @Test
    void rescheduleMovesTheAppointmentThroughTheBookingSteps() {
        Patient patient = savePatient();
        UUID originalId = book(patient, LocalTime.of(9, 0));

        say("hola");
        assertEquals(ConversationState.CANCEL_CONFIRM, say("2").getNextState());
        assertEquals(ConversationState.SELECT_WEEK, say("1").getNextState());
        assertEquals(ConversationState.SELECT_DAY, say("1").getNextState());

        BotResponse hours = say("1");
        assertEquals(List.of("8:00 AM", "10:00 AM", "10:30 AM", "11:00 AM"), hours.getOptions());
        assertEquals(ConversationState.CONFIRM, say("2").getNextState());

        BotResponse done = say("1");

        assertEquals(ConversationState.COMPLETED, done.getNextState());
        assertTrue(done.isSessionComplete());
        Appointment original = appointmentRepository.findById(originalId).orElseThrow();
        assertEquals(Appointment.Status.CANCELLED, original.getStatus());
        assertTrue(original.getNotes().startsWith("Reagendada al 15/01/2025 a las 10:00 AM"));
        List<Appointment> active = bookingService.upcomingForPatient(List.of(patient.getId()));
        assertEquals(1, active.size());
        assertEquals(LocalTime.of(10, 0), active.get(0).getTime());
        assertEquals(Appointment.Status.SCHEDULED, active.get(0).getStatus());
    }

    @Test
    void slotTakenBeforeConfirmationOffersRefreshedHours() {
        savePatient();
        say("hola");
        say("1");
        say("1");
        BotResponse hours = say("1");
        assertEquals("9:00 AM", hours.getOptions().get(2));
        assertEquals(ConversationState.CONFIRM, say("3").getNextState());

        Patient other = patientRepository.save(Patient.builder()
                .organizationId(organization.getId())
                .name("Luis Martínez")
                .phone("+50499998888")
                .build());
        book(other, LocalTime.of(9, 0));

        BotResponse refreshed = say("1");

        assertEquals(ConversationState.SELECT_HOUR, refreshed.getNextState());
        assertTrue(refreshed.getMessage().startsWith(messages.slotTaken()));
        assertEquals(List.of("8:00 AM", "10:00 AM", "10:30 AM", "11:00 AM"), refreshed.getOptions());
        assertEquals(ConversationState.SELECT_HOUR, storedState());
        assertEquals(1, appointmentRepository.count());
    }

    @Test
    void longHourListsArePaged() {
        scheduleRuleRepository.save(ScheduleRule.builder()
                .doctorId(doctor.getId())
                .dayOfWeek(3)
                .startTime(LocalTime.of(13, 0))
                .endTime(LocalTime.of(18, 0))
                .build());
        say("hola");
        say("1");
        say("1");

        BotResponse firstPage = say("1");
        assertEquals(9, firstPage.getOptions().size());
        assertEquals("1:00 PM", firstPage.getOptions().get(7));
        assertEquals(messages.moreHoursOption(), firstPage.getOptions().get(8));

        BotResponse secondPage = say("9");
        assertEquals(ConversationState.SELECT_HOUR, secondPage.getNextState());
        assertEquals(8, secondPage.getOptions().size());
        assertEquals("1:30 PM", secondPage.getOptions().get(0));
        assertFalse(secondPage.getOptions().contains(messages.moreHoursOption()));

        BotResponse confirm = say("1");
        assertEquals(ConversationState.CONFIRM, confirm.getNextState());
        assertTrue(confirm.getMessage().contains("1:30 PM"));
    }

    @Test
    void faqQuestionIsAnsweredThenBackToMenu() {
        faqEntryRepository.save(FaqEntry.builder()
                .organizationId(organization.getId())
                .question("¿Cuál es el horario de atención?")
                .answer("Atendemos de lunes a viernes de 8:00 AM a 5:00 PM.")
                .keywords(List.of("horario"))
                .build());
        say("hola");

        BotResponse ask = say("3");
        assertEquals(ConversationState.FAQ_SEARCH, ask.getNextState());
        assertEquals(messages.askFaq(), ask.getMessage());

        BotResponse answer = say("cual es el horario de atencion");
        assertEquals(ConversationState.FAQ_SEARCH, answer.getNextState());
        assertEquals(messages.faqAnswer("¿Cuál es el horario de atención?",
                "Atendemos de lunes a viernes de 8:00 AM a 5:00 PM."), answer.getMessage());
        assertEquals(messages.faqAnswerOptions(), answer.getOptions());

        BotResponse menu = say("1");
        assertEquals(ConversationState.MAIN_MENU, menu.getNextState());
        assertEquals(BotMessages.MAIN_MENU_OPTIONS, menu.getOptions());
    }

    @Test
    void requestWithoutPhoneIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.handle(new BotRequest(line.getId(), " ", "hola", organization.getId())));
    }

    private Patient savePatient() {
        return patientRepository.save(Patient.builder()
                .organizationId(organization.getId())
                .name("Ana López")
                .phone(PHONE)
                .build());
    }

    private UUID book(Patient patient, LocalTime time) {
        return bookingService.book(new AppointmentBookingService.BookingRequest(
                doctor.getId(), patient.getId(), WEDNESDAY, time, 60, organization.getId(), null))
                .appointment().getId();
    }

    private BotResponse say(String text) {
        return engine.handle(new BotRequest(line.getId(), "50493133496", text, organization.getId()));
    }

    private ConversationState storedState() {
        BotSession session = sessionRepository.findByLineIdAndPatientPhone(line.getId(), PHONE).orElseThrow();
        return session.getState();
    }

    private Appointment.Status status(UUID appointmentId) {
        return appointmentRepository.findById(appointmentId).orElseThrow().getStatus();
    }
}
