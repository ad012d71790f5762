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
import com.ai.clinicbot.utils.AppointmentFormats;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Replies to template quick-reply buttons (and free text when the bot is off): confirm or ask
 * to reschedule the matching appointment, then notify patient and doctor.
 */
@Service
public class LegacyIntentService {

    private static final Logger log = LoggerFactory.getLogger(LegacyIntentService.class);

    private static final List<String> CONFIRM_PATTERNS = List.of("confirm", "confirmar", "si", "sí");
    private static final List<String> RESCHEDULE_PATTERNS = List.of("reagend", "reagendar", "cambiar");
    private static final int LOOK_BACK_DAYS = 2;

    public enum Intent { CONFIRM, RESCHEDULE, UNKNOWN }

    private final AppointmentRepository appointmentRepository;
    private final DoctorRepository doctorRepository;
    private final PatientService patientService;
    private final MessagingGateway messagingGateway;
    private final MessageLogService messageLogService;
    private final Clock clock;

    public LegacyIntentService(AppointmentRepository appointmentRepository,
                               DoctorRepository doctorRepository,
                               PatientService patientService,
                               MessagingGateway messagingGateway,
                               MessageLogService messageLogService,
                               Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.doctorRepository = doctorRepository;
        this.patientService = patientService;
        this.messagingGateway = messagingGateway;
        this.messageLogService = messageLogService;
        this.clock = clock;
    }

    public static Intent detectIntent(String text) {
        if (StringUtils.isBlank(text)) return Intent.UNKNOWN;
        String lower = text.trim().toLowerCase(Locale.ROOT);
        // reschedule first: "si" also occurs inside words like "necesito"
        for (String p : RESCHEDULE_PATTERNS) {
            if (lower.contains(p)) return Intent.RESCHEDULE;
        }
        for (String p : CONFIRM_PATTERNS) {
            if (lower.contains(p)) return Intent.CONFIRM;
        }
        return Intent.UNKNOWN;
    }

    /**
     * @param inbound already-claimed inbound log row; enriched with the matched patient and appointment
     * @return the intent that was applied, or {@link Intent#UNKNOWN} when nothing changed
     */
    public Intent handle(ChannelLine line, MessageLog inbound, String text, UUID payloadAppointmentId) {
        UUID organizationId = line != null ? line.getOrganizationId() : null;
        String fromPhone = inbound.getFromPhone();
        List<Patient> patients = patientService.findAllByPhone(fromPhone, organizationId);
        Patient patient = patients.isEmpty() ? null : patients.get(0);

        Appointment appointment = payloadAppointmentId != null
                ? appointmentRepository.findById(payloadAppointmentId)
                        .filter(a -> a.getStatus() != Appointment.Status.CANCELLED)
                        .orElse(null)
                : findRecentAppointment(patients).orElse(null);

        Intent intent = detectIntent(text);
        log.info("Legacy reply from {}: intent={} patient={} appointment={}", fromPhone, intent,
                patient != null ? patient.getId() : null, appointment != null ? appointment.getId() : null);

        enrichLog(inbound, patient, appointment);

        if (appointment == null || intent == Intent.UNKNOWN) {
            return Intent.UNKNOWN;
        }
        if (patient == null || !patient.getId().equals(appointment.getPatientId())) {
            patient = patientService.findAllByPhone(fromPhone, null).stream()
                    .filter(p -> p.getId().equals(appointment.getPatientId()))
                    .findFirst()
                    .orElse(patient);
        }

        appointment.setStatus(intent == Intent.CONFIRM
                ? Appointment.Status.CONFIRMED
                : Appointment.Status.RESCHEDULE_REQUESTED);
        appointmentRepository.save(appointment);
        log.info("Appointment {} updated to {}", appointment.getId(), appointment.getStatus());

        notifyIntent(intent, appointment, patient, fromPhone, line);
        return intent;
    }

    private Optional<Appointment> findRecentAppointment(List<Patient> patients) {
        if (patients.isEmpty()) return Optional.empty();
        LocalDate from = LocalDate.now(clock).minusDays(LOOK_BACK_DAYS);
        List<Appointment> candidates = appointmentRepository
                .findByPatientIdInAndDateGreaterThanEqualAndStatusInOrderByDateAscTimeAsc(
                        patients.stream().map(Patient::getId).toList(), from,
                        AppointmentBookingService.ACTIVE_STATUSES);
        if (candidates.size() > 1) {
            log.warn("Reply without appointment id matched {} active appointments, using the soonest ({})",
                    candidates.size(), candidates.get(0).getId());
        }
        return candidates.stream().findFirst();
    }

    private void enrichLog(MessageLog inbound, Patient patient, Appointment appointment) {
        if (patient == null && appointment == null) return;
        if (patient != null) inbound.setPatientId(patient.getId());
        if (appointment != null) {
            inbound.setAppointmentId(appointment.getId());
            inbound.setDoctorId(appointment.getDoctorId());
        }
        try {
            messageLogService.record(inbound);
        } catch (RuntimeException e) {
            log.error("Could not link inbound {} to its appointment", inbound.getProviderMessageId(), e);
        }
    }

    private void notifyIntent(Intent intent, Appointment appointment, Patient patient, String fromPhone, ChannelLine line) {
        UUID lineId = line != null ? line.getId() : null;
        UUID patientId = patient != null ? patient.getId() : appointment.getPatientId();
        if (intent == Intent.CONFIRM) {
            send(MessageType.PATIENT_CONFIRMED, fromPhone,
                    Map.of("1", AppointmentFormats.time(appointment.getTime())),
                    appointment, patientId, lineId);
            return;
        }
        Doctor doctor = doctorRepository.findById(appointment.getDoctorId()).orElse(null);
        if (doctor != null && StringUtils.isNotBlank(doctor.getPhone())) {
            String patientName = patient != null ? patient.getName() : "Paciente";
            send(MessageType.RESCHEDULE_DOCTOR, doctor.getPhone(),
                    Map.of("1", patientName, "2", fromPhone),
                    appointment, patientId, lineId);
        } else {
            log.info("Doctor of appointment {} has no phone, reschedule notice skipped", appointment.getId());
        }
        send(MessageType.PATIENT_RESCHEDULE, fromPhone, Map.of(), appointment, patientId, lineId);
    }

    private void send(MessageType type, String to, Map<String, String> params,
                      Appointment appointment, UUID patientId, UUID lineId) {
        GatewaySendResult result = messagingGateway.send(GatewaySendRequest.builder()
                .to(to)
                .type(type)
                .templateParams(new LinkedHashMap<>(params))
                .appointmentId(appointment.getId())
                .patientId(patientId)
                .doctorId(appointment.getDoctorId())
                .organizationId(appointment.getOrganizationId())
                .lineId(lineId)
                .build());
        if (!result.isOk()) {
            log.warn("{} for appointment {} not sent: {} {}", type.code(), appointment.getId(),
                    result.getErrorCode(), result.getError());
        }
    }
}
