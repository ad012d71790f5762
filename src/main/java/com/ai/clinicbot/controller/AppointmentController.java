package com.ai.clinicbot.controller;

import com.ai.clinicbot.dto.AppointmentCreatedResponse;
import com.ai.clinicbot.dto.AvailableSlotsResponse;
import com.ai.clinicbot.dto.CreateAppointmentRequest;
import com.ai.clinicbot.dto.ErrorResponse;
import com.ai.clinicbot.entity.Doctor;
import com.ai.clinicbot.entity.Patient;
import com.ai.clinicbot.messaging.GatewayErrorCodes;
import com.ai.clinicbot.messaging.GatewaySendResult;
import com.ai.clinicbot.repository.DoctorRepository;
import com.ai.clinicbot.repository.PatientRepository;
import com.ai.clinicbot.service.AppointmentBookingService;
import com.ai.clinicbot.service.AppointmentBookingService.BookingRequest;
import com.ai.clinicbot.service.AppointmentBookingService.BookingResult;
import com.ai.clinicbot.service.AppointmentNotificationService;
import com.ai.clinicbot.service.SlotAvailabilityService;
import com.ai.clinicbot.utils.AppointmentFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

/**
 * Staff-side booking and availability. Bookings go through the same re-validated path as the bot.
 */
@RestController
@RequestMapping("/internal")
public class AppointmentController {

    private static final Logger log = LoggerFactory.getLogger(AppointmentController.class);
    private static final int DEFAULT_DURATION_MINUTES = 60;
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final SlotAvailabilityService slotAvailabilityService;
    private final AppointmentBookingService bookingService;
    private final AppointmentNotificationService notificationService;
    private final DoctorRepository doctorRepository;
    private final PatientRepository patientRepository;

    public AppointmentController(SlotAvailabilityService slotAvailabilityService,
                                 AppointmentBookingService bookingService,
                                 AppointmentNotificationService notificationService,
                                 DoctorRepository doctorRepository,
                                 PatientRepository patientRepository) {
        this.slotAvailabilityService = slotAvailabilityService;
        this.bookingService = bookingService;
        this.notificationService = notificationService;
        this.doctorRepository = doctorRepository;
        this.patientRepository = patientRepository;
    }

    @GetMapping("/availability/slots")
    public AvailableSlotsResponse availableSlots(@RequestParam UUID doctorId,
                                                 @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                                 @RequestParam(defaultValue = "60") int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("durationMinutes must be positive");
        }
        List<LocalTime> slots = slotAvailabilityService.availableSlots(doctorId, date, durationMinutes);
        return new AvailableSlotsResponse(doctorId, date, durationMinutes,
                slots.stream().map(HH_MM::format).toList(),
                slots.stream().map(AppointmentFormats::time).toList());
    }

    @PostMapping("/appointments")
    public ResponseEntity<?> create(@RequestBody CreateAppointmentRequest request) {
        if (request.getDoctorId() == null || request.getPatientId() == null
                || request.getDate() == null || request.getTime() == null) {
            return ResponseEntity.badRequest().body(ErrorResponse.of(
                    "doctorId, patientId, date and time are required", GatewayErrorCodes.VALIDATION_ERROR));
        }
        Doctor doctor = doctorRepository.findById(request.getDoctorId()).orElse(null);
        Patient patient = patientRepository.findById(request.getPatientId()).orElse(null);
        if (doctor == null || patient == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.of("Doctor or patient not found", "NOT_FOUND"));
        }
        int duration = request.getDurationMinutes() != null && request.getDurationMinutes() > 0
                ? request.getDurationMinutes() : DEFAULT_DURATION_MINUTES;

        BookingResult result = bookingService.book(new BookingRequest(doctor.getId(), patient.getId(),
                request.getDate(), request.getTime(), duration, doctor.getOrganizationId(), request.getNotes()));
        if (!result.success()) {
            HttpStatus status = result.outcome() == AppointmentBookingService.Outcome.CONFLICT
                    ? HttpStatus.CONFLICT : HttpStatus.NOT_FOUND;
            return ResponseEntity.status(status).body(ErrorResponse.of(result.message(), result.outcome().name()));
        }

        GatewaySendResult notification = null;
        if (!Boolean.FALSE.equals(request.getSendConfirmation())) {
            notification = notificationService.sendConfirmation(result.appointment(), patient, doctor);
        }
        log.info("Staff booked appointment {} for doctor {} on {} {}", result.appointment().getId(),
                doctor.getId(), request.getDate(), request.getTime());
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentCreatedResponse.of(result.appointment(), notification));
    }
}
