package com.ai.clinicbot.service;

import com.ai.clinicbot.entity.Appointment;
import com.ai.clinicbot.entity.Doctor;
import com.ai.clinicbot.entity.Patient;
import com.ai.clinicbot.messaging.GatewaySendRequest;
import com.ai.clinicbot.messaging.GatewaySendResult;
import com.ai.clinicbot.messaging.MessageType;
import com.ai.clinicbot.messaging.MessagingGateway;
import com.ai.clinicbot.utils.AppointmentFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Template messages tied to one appointment.
 */
@Service
public class AppointmentNotificationService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentNotificationService.class);

    private final MessagingGateway messagingGateway;

    public AppointmentNotificationService(MessagingGateway messagingGateway) {
        this.messagingGateway = messagingGateway;
    }

    /** {1: patient, 2: doctor, 3: "dd/MM/yyyy a las h:mm AM"}. */
    public GatewaySendResult sendConfirmation(Appointment appointment, Patient patient, Doctor doctor) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("1", patient.getName());
        params.put("2", doctor.displayName());
        params.put("3", AppointmentFormats.dateTime(appointment.getDate(), appointment.getTime()));
        return send(MessageType.CONFIRMATION, patient.getPhone(), params, appointment, patient, doctor);
    }

    /** {1: patient, 2: doctor, 3: dd/MM/yyyy, 4: h:mm AM}. */
    public GatewaySendResult sendReminder(Appointment appointment, Patient patient, Doctor doctor) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("1", patient.getName());
        params.put("2", doctor.displayName());
        params.put("3", AppointmentFormats.date(appointment.getDate()));
        params.put("4", AppointmentFormats.time(appointment.getTime()));
        return send(MessageType.REMINDER_24H, patient.getPhone(), params, appointment, patient, doctor);
    }

    private GatewaySendResult send(MessageType type, String to, Map<String, String> params,
                                   Appointment appointment, Patient patient, Doctor doctor) {
        GatewaySendResult result = messagingGateway.send(GatewaySendRequest.builder()
                .to(to)
                .type(type)
                .templateParams(params)
                .appointmentId(appointment.getId())
                .patientId(patient.getId())
                .doctorId(doctor.getId())
                .organizationId(appointment.getOrganizationId())
                .build());
        if (!result.isOk()) {
            log.warn("{} for appointment {} not sent: {} {}", type.code(), appointment.getId(),
                    result.getErrorCode(), result.getError());
        }
        return result;
    }
}
