package com.ai.clinicbot.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class CreateAppointmentRequest {

    private UUID doctorId;

    private UUID patientId;

    private LocalDate date;

    private LocalTime time;

    private Integer durationMinutes;

    private String notes;

    /** Defaults to true; staff may book without notifying the patient. */
    private Boolean sendConfirmation;
}
