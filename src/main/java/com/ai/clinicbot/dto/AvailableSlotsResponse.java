package com.ai.clinicbot.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/** Slots as "HH:mm" strings plus the patient-facing "h:mm AM" labels. */
public record AvailableSlotsResponse(UUID doctorId, LocalDate date, int durationMinutes,
                                     List<String> slots, List<String> labels) {
}
