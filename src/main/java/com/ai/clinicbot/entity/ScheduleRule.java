package com.ai.clinicbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalTime;
import java.util.UUID;

/**
 * Recurring weekly working window. Owned either by a doctor or by a shared
 * calendar; exactly one of the two ids is set.
 */
@Entity
@Table(name = "schedule_rule", indexes = {
    @Index(name = "idx_schedule_rule_doctor", columnList = "doctor_id, day_of_week"),
    @Index(name = "idx_schedule_rule_calendar", columnList = "calendar_id, day_of_week")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "doctor_id")
    private UUID doctorId;

    @Column(name = "calendar_id")
    private UUID calendarId;

    /**
     * Day of week: 0 = Sunday ... 6 = Saturday
     */
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;
}
