package com.ai.clinicbot.service;

import com.ai.clinicbot.entity.Appointment;
import com.ai.clinicbot.entity.ChannelLine;
import com.ai.clinicbot.entity.Doctor;
import com.ai.clinicbot.entity.MessageLog;
import com.ai.clinicbot.entity.Patient;
import com.ai.clinicbot.messaging.GatewaySendRequest;
import com.ai.clinicbot.messaging.GatewaySendResult;
import com.ai.clinicbot.messaging.MessageType;
import com.ai.clinicbot.messaging.MessagingGateway;
import com.ai.clinicbot.repository.AppointmentRepository;
import com.ai.clinicbot.repository.DoctorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LegacyIntentServiceTest {

    private static final String PHONE = "+50493133496";
    private static final UUID ORG = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private DoctorRepository doctorRepository;
    @Mock
    private PatientService patientService;
    @Mock
    private MessagingGateway messagingGateway;
    @Mock
    private MessageLogService messageLogService;

    private LegacyIntentService service;
    private ChannelLine line;
    private Patient patient;
    private Doctor doctor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-14T16:00:00Z"), ZoneId.of("America/Tegucigalpa"));
        service = new LegacyIntentService(appointmentRepository, doctorRepository, patientService,
                messagingGateway, messageLogService, clock);
        line = ChannelLine.builder().id(UUID.randomUUID()).organizationId(ORG).build();
        patient = Patient.builder().id(UUID.randomUUID()).organizationId(ORG).name("Ana López").phone(PHONE).build();
        doctor = Doctor.builder().id(UUID.randomUUID()).organizationId(ORG).name("Pérez").phone("+50499990000").build();
        lenient().when(patientService.findAllByPhone(PHONE, ORG)).thenReturn(List.of(patient));
        lenient().when(messagingGateway.send(any())).thenReturn(GatewaySendResult.builder().ok(true).status("sent").build());
    }

    @Test
    void intentsAreDetectedBySubstring() {
        assertEquals(LegacyIntentService.Intent.CONFIRM, LegacyIntentService.detectIntent("Confirmar cita"));
        assertEquals(LegacyIntentService.Intent.CONFIRM, LegacyIntentService.detectIntent(" Sí "));
        assertEquals(LegacyIntentService.Intent.RESCHEDULE, LegacyIntentService.detectIntent("Reagendar"));
        assertEquals(LegacyIntentService.Intent.RESCHEDULE, LegacyIntentService.detectIntent("quiero cambiar la hora"));
        assertEquals(LegacyIntentService.Intent.UNKNOWN, LegacyIntentService.detectIntent("gracias"));
        assertEquals(LegacyIntentService.Intent.UNKNOWN, LegacyIntentService.detectIntent("  "));
    }

    @Test
    void rescheduleWordsWinOverAnEmbeddedSi() {
        assertEquals(LegacyIntentService.Intent.RESCHEDULE, LegacyIntentService.detectIntent("necesito reagendar"));
        assertEquals(LegacyIntentService.Intent.RESCHEDULE, LegacyIntentService.detectIntent("Sí, quiero cambiar la cita"));
        assertEquals(LegacyIntentService.Intent.CONFIRM, LegacyIntentService.detectIntent("si"));
    }

    @Test
    void confirmWithPayloadIdConfirmsThatAppointment() {
        Appointment appointment = appointment(LocalDate.of(2025, 1, 15), LocalTime.of(15, 0));
        when(appointmentRepository.findById(appointment.getId())).thenReturn(Optional.of(appointment));
        MessageLog inbound = inbound();

        LegacyIntentService.Intent intent = service.handle(line, inbound, "Confirmar", appointment.getId());

        assertEquals(LegacyIntentService.Intent.CONFIRM, intent);
        assertEquals(Appointment.Status.CONFIRMED, appointment.getStatus());
        assertEquals(appointment.getId(), inbound.getAppointmentId());
        assertEquals(patient.getId(), inbound.getPatientId());
        verify(messageLogService).record(inbound);
        verify(appointmentRepository).save(appointment);

        ArgumentCaptor<GatewaySendRequest> sent = ArgumentCaptor.forClass(GatewaySendRequest.class);
        verify(messagingGateway).send(sent.capture());
        assertEquals(MessageType.PATIENT_CONFIRMED, sent.getValue().getType());
        assertEquals(PHONE, sent.getValue().getTo());
        assertEquals("3:00 PM", sent.getValue().getTemplateParams().get("1"));
    }

    @Test
    void rescheduleWithoutPayloadUsesSoonestActiveAppointmentAndNotifiesDoctor() {
        Appointment soonest = appointment(LocalDate.of(2025, 1, 15), LocalTime.of(9, 0));
        Appointment later = appointment(LocalDate.of(2025, 1, 20), LocalTime.of(9, 0));
        when(appointmentRepository.findByPatientIdInAndDateGreaterThanEqualAndStatusInOrderByDateAscTimeAsc(
                eq(List.of(patient.getId())), eq(LocalDate.of(2025, 1, 12)), any()))
                .thenReturn(List.of(soonest, later));
        when(doctorRepository.findById(doctor.getId())).thenReturn(Optional.of(doctor));

        LegacyIntentService.Intent intent = service.handle(line, inbound(), "reagendar por favor", null);

        assertEquals(LegacyIntentService.Intent.RESCHEDULE, intent);
        assertEquals(Appointment.Status.RESCHEDULE_REQUESTED, soonest.getStatus());
        assertEquals(Appointment.Status.SCHEDULED, later.getStatus());

        ArgumentCaptor<GatewaySendRequest> sent = ArgumentCaptor.forClass(GatewaySendRequest.class);
        verify(messagingGateway, times(2)).send(sent.capture());
        GatewaySendRequest toDoctor = sent.getAllValues().get(0);
        assertEquals(MessageType.RESCHEDULE_DOCTOR, toDoctor.getType());
        assertEquals("+50499990000", toDoctor.getTo());
        assertEquals("Ana López", toDoctor.getTemplateParams().get("1"));
        assertEquals(PHONE, toDoctor.getTemplateParams().get("2"));
        assertEquals(MessageType.PATIENT_RESCHEDULE, sent.getAllValues().get(1).getType());
    }

    @Test
    void unknownTextChangesNothing() {
        Appointment appointment = appointment(LocalDate.of(2025, 1, 15), LocalTime.of(9, 0));
        when(appointmentRepository.findByPatientIdInAndDateGreaterThanEqualAndStatusInOrderByDateAscTimeAsc(
                anyList(), any(), any())).thenReturn(List.of(appointment));

        LegacyIntentService.Intent intent = service.handle(line, inbound(), "gracias", null);

        assertEquals(LegacyIntentService.Intent.UNKNOWN, intent);
        assertEquals(Appointment.Status.SCHEDULED, appointment.getStatus());
        verify(appointmentRepository, never()).save(any());
        verify(messagingGateway, never()).send(any());
    }

    @Test
    void cancelledPayloadAppointmentIsIgnored() {
        Appointment cancelled = appointment(LocalDate.of(2025, 1, 15), LocalTime.of(9, 0));
        cancelled.setStatus(Appointment.Status.CANCELLED);
        when(appointmentRepository.findById(cancelled.getId())).thenReturn(Optional.of(cancelled));

        LegacyIntentService.Intent intent = service.handle(line, inbound(), "Confirmar", cancelled.getId());

        assertEquals(LegacyIntentService.Intent.UNKNOWN, intent);
        assertEquals(Appointment.Status.CANCELLED, cancelled.getStatus());
        verify(messagingGateway, never()).send(any());
    }

    private Appointment appointment(LocalDate date, LocalTime time) {
        return Appointment.builder()
                .id(UUID.randomUUID())
                .organizationId(ORG)
                .doctorId(doctor.getId())
                .patientId(patient.getId())
                .date(date)
                .time(time)
                .durationMinutes(60)
                .status(Appointment.Status.SCHEDULED)
                .build();
    }

    private MessageLog inbound() {
        return MessageLog.builder()
                .direction(MessageLog.Direction.INBOUND)
                .fromPhone(PHONE)
                .type(MessageType.PATIENT_REPLY)
                .providerMessageId("wamid.in")
                .build();
    }
}
