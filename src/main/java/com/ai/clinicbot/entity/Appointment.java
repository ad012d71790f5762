package com.ai.clinicbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_doctor_date", columnList = "doctor_id, appointment_date"),
    @Index(name = "idx_appointment_patient", columnList = "patient_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_appointment_slot_key", columnNames = "slot_key")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public enum Status { SCHEDULED, CONFIRMED, RESCHEDULE_REQUESTED, CANCELLED }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "doctor_id", nullable = false)
    private UUID doctorId;

    @Column(name = "patient_id", nullable = false)
    private UUID patientId;

    @Column(name = "calendar_id")
    private UUID calendarId;

    @Column(name = "organization_id")
    private UUID organizationId;

    @Column(name = "appointment_date", nullable = false)
    private LocalDate date;

    @Column(name = "appointment_time", nullable = false)
    private LocalTime time;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private Status status = Status.SCHEDULED;

    @Column(length = 1000)
    private String notes;

    /**
     * {@code <resource>|<date>|<time>} while the appointment is active, null once cancelled.
     * The unique constraint on it is the last line of defense against double booking.
     */
    @Column(name = "slot_key", length = 120)
    private String slotKey;

    @Column(name = "reminder_sent_at")
    private Instant reminderSentAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean isReminderSent() {
        return reminderSentAt != null;
    }

    public boolean isActive() {
        return status != Status.CANCELLED;
    }

    public LocalTime endTime() {
        return time.plusMinutes(durationMinutes);
    }

    public static String slotKey(UUID resourceId, LocalDate date, LocalTime time) {
        return resourceId + "|" + date + "|" + time;
    }
}
