package com.ai.clinicbot.service;

import com.ai.clinicbot.dto.ReminderRunResult;
import com.ai.clinicbot.entity.Appointment;
import com.ai.clinicbot.entity.Doctor;
import com.ai.clinicbot.entity.Organization;
import com.ai.clinicbot.entity.Patient;
import com.ai.clinicbot.messaging.GatewaySendResult;
import com.ai.clinicbot.repository.AppointmentRepository;
import com.ai.clinicbot.repository.DoctorRepository;
import com.ai.clinicbot.repository.OrganizationRepository;
import com.ai.clinicbot.repository.PatientRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 24-hour reminders for tomorrow's appointments. Safe to re-run: only appointments without
 * {@code reminderSentAt} are picked up and the timestamp is written right after a successful send.
 */
@Service
public class ReminderService {

    private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

    private final AppointmentRepository appointmentRepository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final OrganizationRepository organizationRepository;
    private final AppointmentNotificationService notificationService;
    private final Clock clock;

    public ReminderService(AppointmentRepository appointmentRepository,
                           PatientRepository patientRepository,
                           DoctorRepository doctorRepository,
                           OrganizationRepository organizationRepository,
                           AppointmentNotificationService notificationService,
                           Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.patientRepository = patientRepository;
        this.doctorRepository = doctorRepository;
        this.organizationRepository = organizationRepository;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    @Scheduled(cron = "${clinicbot.reminders.cron:-}", zone = "${clinicbot.timezone:America/Tegucigalpa}")
    public void scheduledRun() {
        ReminderRunResult result = sendTomorrowReminders();
        log.info("Scheduled reminder run for {}: sent={} failed={} skipped={}",
                result.date(), result.sent(), result.failed(), result.skipped());
    }

    public ReminderRunResult sendTomorrowReminders() {
        LocalDate tomorrow = LocalDate.now(clock).plusDays(1);
        Set<UUID> disabledOrgs = organizationRepository.findAll().stream()
                .filter(o -> !o.isMessagingEnabled())
                .map(Organization::getId)
                .collect(Collectors.toSet());
        List<Appointment> due = appointmentRepository.findByDateAndStatusInAndReminderSentAtIsNullOrderByTimeAsc(
                tomorrow, AppointmentBookingService.ACTIVE_STATUSES);
        log.info("Reminder run for {}: {} appointments pending", tomorrow, due.size());

        int sent = 0;
        int failed = 0;
        int skipped = 0;
        for (Appointment appointment : due) {
            if (appointment.getOrganizationId() != null && disabledOrgs.contains(appointment.getOrganizationId())) {
                skipped++;
                continue;
            }
            Patient patient = patientRepository.findById(appointment.getPatientId()).orElse(null);
            Doctor doctor = doctorRepository.findById(appointment.getDoctorId()).orElse(null);
            if (patient == null || doctor == null || StringUtils.isBlank(patient.getPhone())) {
                log.warn("Reminder for appointment {} skipped: missing patient, doctor or phone", appointment.getId());
                failed++;
                continue;
            }
            GatewaySendResult result = notificationService.sendReminder(appointment, patient, doctor);
            if (result.isOk()) {
                appointment.setReminderSentAt(clock.instant());
                appointmentRepository.save(appointment);
                sent++;
            } else {
                failed++;
            }
        }
        return new ReminderRunResult(true, tomorrow, due.size(), sent, failed, skipped);
    }
}
