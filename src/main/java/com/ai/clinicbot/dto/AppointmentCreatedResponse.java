package com.ai.clinicbot.dto;

import com.ai.clinicbot.entity.Appointment;
import com.ai.clinicbot.messaging.GatewaySendResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AppointmentCreatedResponse(boolean ok, UUID appointmentId, LocalDate date, LocalTime time,
                                         Appointment.Status status, GatewaySendResult notification) {

    public static AppointmentCreatedResponse of(Appointment appointment, GatewaySendResult notification) {
        return new AppointmentCreatedResponse(true, appointment.getId(), appointment.getDate(), appointment.getTime(),
                appointment.getStatus(), notification);
    }
}
