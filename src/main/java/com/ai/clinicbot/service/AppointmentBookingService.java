package com.ai.clinicbot.service;

import com.ai.clinicbot.entity.Appointment;
import com.ai.clinicbot.entity.Doctor;
import com.ai.clinicbot.repository.AppointmentRepository;
import com.ai.clinicbot.repository.DoctorRepository;
import com.ai.clinicbot.utils.AppointmentFormats;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Concurrency-safe booking. Every write locks the bookable resource, re-reads availability
 * under that lock and is backed by the unique slot key, so a lost race surfaces as
 * {@link Outcome#CONFLICT}.
 */
@Service
public class AppointmentBookingService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentBookingService.class);
    private static final int UPCOMING_LIMIT = 5;
    public static final Set<Appointment.Status> ACTIVE_STATUSES =
            EnumSet.of(Appointment.Status.SCHEDULED, Appointment.Status.CONFIRMED);

    private final AppointmentRepository appointmentRepository;
    private final DoctorRepository doctorRepository;
    private final SlotAvailabilityService slotAvailabilityService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AppointmentBookingService(AppointmentRepository appointmentRepository,
                                     DoctorRepository doctorRepository,
                                     SlotAvailabilityService slotAvailabilityService,
                                     TransactionTemplate transactionTemplate,
                                     Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.doctorRepository = doctorRepository;
        this.slotAvailabilityService = slotAvailabilityService;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public BookingResult book(BookingRequest request) {
        try {
            return transactionTemplate.execute(status -> {
                Doctor doctor = lockResource(request.doctorId());
                if (doctor == null) return BookingResult.notFound("Doctor not found.");
                if (!isStillAvailable(doctor, request.date(), request.time(), request.durationMinutes())) {
                    return BookingResult.conflict("This slot is no longer available.");
                }
                Appointment appointment = appointmentRepository.saveAndFlush(newAppointment(doctor, request));
                log.info("Booked appointment {}: doctor={}, date={}, time={}",
                        appointment.getId(), doctor.getId(), request.date(), request.time());
                return BookingResult.success(appointment, null);
            });
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            log.warn("Slot {} {} for doctor {} taken concurrently", request.date(), request.time(), request.doctorId());
            return BookingResult.conflict("This slot is no longer available.");
        }
    }

    /**
     * Cancel the appointment with a reschedule note and create its replacement, atomically.
     * If the new slot is taken nothing changes.
     */
    public BookingResult reschedule(UUID appointmentId, LocalDate newDate, LocalTime newTime) {
        try {
            return transactionTemplate.execute(status -> {
                Appointment previous = appointmentRepository.findByIdForUpdate(appointmentId).orElse(null);
                if (previous == null) return BookingResult.notFound("Appointment not found.");
                if (!previous.isActive()) return BookingResult.conflict("Appointment is cancelled.");
                Doctor doctor = lockResource(previous.getDoctorId());
                if (doctor == null) return BookingResult.notFound("Doctor not found.");

                markCancelled(previous, "Reagendada al " + AppointmentFormats.dateTime(newDate, newTime));
                appointmentRepository.saveAndFlush(previous);

                if (!isStillAvailable(doctor, newDate, newTime, previous.getDurationMinutes())) {
                    status.setRollbackOnly();
                    return BookingResult.conflict("This slot is no longer available.");
                }
                BookingRequest request = new BookingRequest(doctor.getId(), previous.getPatientId(), newDate, newTime,
                        previous.getDurationMinutes(), previous.getOrganizationId(),
                        "Reagendada desde " + AppointmentFormats.dateTime(previous.getDate(), previous.getTime()));
                Appointment replacement = appointmentRepository.saveAndFlush(newAppointment(doctor, request));
                log.info("Rescheduled appointment {} to {} ({} {})", appointmentId, replacement.getId(), newDate, newTime);
                return BookingResult.success(replacement, previous);
            });
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            log.warn("Reschedule of {} lost the race for {} {}", appointmentId, newDate, newTime);
            return BookingResult.conflict("This slot is no longer available.");
        }
    }

    @Transactional
    public BookingResult cancel(UUID appointmentId, String reason) {
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId).orElse(null);
        if (appointment == null) return BookingResult.notFound("Appointment not found.");
        if (!appointment.isActive()) return BookingResult.conflict("Appointment already cancelled.");
        markCancelled(appointment, reason);
        appointmentRepository.save(appointment);
        log.info("Cancelled appointment {}", appointmentId);
        return BookingResult.success(appointment, null);
    }

    /** Up to five upcoming scheduled or confirmed appointments, soonest first. */
    @Transactional(readOnly = true)
    public List<Appointment> upcomingForPatient(Collection<UUID> patientIds) {
        if (patientIds.isEmpty()) return List.of();
        return appointmentRepository
                .findByPatientIdInAndDateGreaterThanEqualAndStatusInOrderByDateAscTimeAsc(
                        patientIds, LocalDate.now(clock), ACTIVE_STATUSES)
                .stream()
                .limit(UPCOMING_LIMIT)
                .toList();
    }

    /**
     * Row lock on the doctor, or on every doctor of its shared calendar, held until the
     * surrounding transaction ends. Overlapping bookings on one resource are serialized here.
     */
    private Doctor lockResource(UUID doctorId) {
        Doctor doctor = doctorRepository.findById(doctorId).orElse(null);
        if (doctor == null) return null;
        if (doctor.getCalendarId() == null) {
            return doctorRepository.findByIdForUpdate(doctorId).orElse(null);
        }
        doctorRepository.lockByCalendarId(doctor.getCalendarId());
        return doctor;
    }

    private boolean isStillAvailable(Doctor doctor, LocalDate date, LocalTime time, int durationMinutes) {
        return slotAvailabilityService.bookableSlots(doctor.getId(), date, durationMinutes).contains(time);
    }

    private static Appointment newAppointment(Doctor doctor, BookingRequest request) {
        return Appointment.builder()
                .doctorId(doctor.getId())
                .calendarId(doctor.getCalendarId())
                .patientId(request.patientId())
                .organizationId(request.organizationId() != null ? request.organizationId() : doctor.getOrganizationId())
                .date(request.date())
                .time(request.time())
                .durationMinutes(request.durationMinutes())
                .status(Appointment.Status.SCHEDULED)
                .notes(request.notes())
                .slotKey(Appointment.slotKey(SlotAvailabilityService.resourceId(doctor), request.date(), request.time()))
                .build();
    }

    private static void markCancelled(Appointment appointment, String note) {
        appointment.setStatus(Appointment.Status.CANCELLED);
        appointment.setSlotKey(null);
        if (StringUtils.isNotBlank(note)) {
            appointment.setNotes(StringUtils.isBlank(appointment.getNotes())
                    ? note
                    : appointment.getNotes() + "\n" + note);
        }
    }

    public record BookingRequest(UUID doctorId, UUID patientId, LocalDate date, LocalTime time,
                                 int durationMinutes, UUID organizationId, String notes) {
    }

    public enum Outcome { SUCCESS, CONFLICT, NOT_FOUND }

    public record BookingResult(Outcome outcome, String message, Appointment appointment, Appointment previous) {
        public static BookingResult success(Appointment a, Appointment previous) {
            return new BookingResult(Outcome.SUCCESS, null, a, previous);
        }
        public static BookingResult conflict(String msg) {
            return new BookingResult(Outcome.CONFLICT, msg, null, null);
        }
        public static BookingResult notFound(String msg) {
            return new BookingResult(Outcome.NOT_FOUND, msg, null, null);
        }
        public boolean success() {
            return outcome == Outcome.SUCCESS;
        }
    }
}
