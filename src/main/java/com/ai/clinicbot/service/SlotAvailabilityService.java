package com.ai.clinicbot.service;

import com.ai.clinicbot.entity.Appointment;
import com.ai.clinicbot.entity.Doctor;
import com.ai.clinicbot.entity.ScheduleRule;
import com.ai.clinicbot.repository.AppointmentRepository;
import com.ai.clinicbot.repository.DoctorRepository;
import com.ai.clinicbot.repository.ScheduleRuleRepository;
import com.ai.clinicbot.utils.AppointmentFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Open-slot computation against weekly schedule rules and existing bookings.
 * Doctors sharing a calendar share its rules and conflict with each other's appointments.
 * Results are advisory; booking re-validates before writing.
 */
@Service
public class SlotAvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(SlotAvailabilityService.class);
    public static final int DEFAULT_GRANULARITY_MINUTES = 30;
    private static final long MINUTE_MILLIS = 60_000L;

    private final DoctorRepository doctorRepository;
    private final ScheduleRuleRepository scheduleRuleRepository;
    private final AppointmentRepository appointmentRepository;
    private final Clock clock;

    public SlotAvailabilityService(DoctorRepository doctorRepository,
                                   ScheduleRuleRepository scheduleRuleRepository,
                                   AppointmentRepository appointmentRepository,
                                   Clock clock) {
        this.doctorRepository = doctorRepository;
        this.scheduleRuleRepository = scheduleRuleRepository;
        this.appointmentRepository = appointmentRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<LocalTime> availableSlots(UUID doctorId, LocalDate date, int durationMinutes) {
        return availableSlots(doctorId, date, durationMinutes, DEFAULT_GRANULARITY_MINUTES);
    }

    /**
     * Start times on {@code date} where a {@code durationMinutes} appointment fits inside a
     * schedule window without overlapping any non-cancelled booking. Ordered, no duplicates.
     * Past times are not filtered here.
     */
    @Transactional(readOnly = true)
    public List<LocalTime> availableSlots(UUID doctorId, LocalDate date, int durationMinutes, int granularityMinutes) {
        if (durationMinutes <= 0 || granularityMinutes <= 0) {
            throw new IllegalArgumentException("Duration and granularity must be positive");
        }
        Doctor doctor = doctorRepository.findById(doctorId).orElse(null);
        if (doctor == null) {
            log.warn("Slot lookup for unknown doctor {}", doctorId);
            return List.of();
        }

        int dayOfWeek = AppointmentFormats.scheduleDayOfWeek(date);
        List<ScheduleRule> rules = doctor.getCalendarId() != null
                ? scheduleRuleRepository.findByCalendarIdAndDayOfWeekOrderByStartTimeAsc(doctor.getCalendarId(), dayOfWeek)
                : scheduleRuleRepository.findByDoctorIdAndDayOfWeekOrderByStartTimeAsc(doctorId, dayOfWeek);
        if (rules.isEmpty()) return List.of();

        List<long[]> occupied = appointmentRepository
                .findByDoctorIdInAndDateAndStatusNot(coAssignedDoctorIds(doctor), date, Appointment.Status.CANCELLED)
                .stream()
                .map(a -> new long[]{toMillis(a.getTime()), toMillis(a.getTime()) + a.getDurationMinutes() * MINUTE_MILLIS})
                .toList();

        long duration = durationMinutes * MINUTE_MILLIS;
        long step = granularityMinutes * MINUTE_MILLIS;
        TreeSet<LocalTime> slots = new TreeSet<>();
        for (ScheduleRule rule : rules) {
            long windowEnd = toMillis(rule.getEndTime());
            for (long t = toMillis(rule.getStartTime()); t + duration <= windowEnd; t += step) {
                if (isFree(t, t + duration, occupied)) {
                    slots.add(LocalTime.ofNanoOfDay(t * 1_000_000L));
                }
            }
        }
        return new ArrayList<>(slots);
    }

    /** Slots for a date with times already past removed when the date is today. */
    @Transactional(readOnly = true)
    public List<LocalTime> bookableSlots(UUID doctorId, LocalDate date, int durationMinutes) {
        LocalDate today = LocalDate.now(clock);
        if (date.isBefore(today)) return List.of();
        List<LocalTime> slots = availableSlots(doctorId, date, durationMinutes);
        if (!date.equals(today)) return slots;
        LocalTime now = LocalTime.now(clock);
        return slots.stream().filter(t -> t.isAfter(now)).toList();
    }

    /** Days from {@code from} to {@code to} (inclusive) with at least one bookable slot. */
    @Transactional(readOnly = true)
    public List<LocalDate> availableDays(UUID doctorId, LocalDate from, LocalDate to, int durationMinutes) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (!bookableSlots(doctorId, d, durationMinutes).isEmpty()) {
                days.add(d);
            }
        }
        return days;
    }

    @Transactional(readOnly = true)
    public boolean hasAvailability(UUID doctorId, LocalDate from, LocalDate to, int durationMinutes) {
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (!bookableSlots(doctorId, d, durationMinutes).isEmpty()) return true;
        }
        return false;
    }

    /** The bookable resource: the shared calendar when the doctor has one, else the doctor. */
    public static UUID resourceId(Doctor doctor) {
        return doctor.getCalendarId() != null ? doctor.getCalendarId() : doctor.getId();
    }

    private Set<UUID> coAssignedDoctorIds(Doctor doctor) {
        if (doctor.getCalendarId() == null) return Set.of(doctor.getId());
        Set<UUID> ids = doctorRepository.findByCalendarId(doctor.getCalendarId()).stream()
                .map(Doctor::getId)
                .collect(Collectors.toCollection(TreeSet::new));
        ids.add(doctor.getId());
        return ids;
    }

    private static boolean isFree(long start, long end, List<long[]> occupied) {
        for (long[] interval : occupied) {
            if (start < interval[1] && interval[0] < end) return false;
        }
        return true;
    }

    private static long toMillis(LocalTime time) {
        return time.toSecondOfDay() * 1000L;
    }
}
