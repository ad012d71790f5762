package com.ai.clinicbot.conversation.context;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
public final class RescheduleContext extends FlowContext {

    /** Sub-state of {@code cancel_confirm}. */
    public enum CancelConfirmPhase {
        CHOOSE_ACTION,
        CONFIRM_CANCEL
    }

    private UUID patientId;
    private String patientName;
    private List<AppointmentOption> appointments = new ArrayList<>();
    private UUID selectedAppointmentId;
    private CancelConfirmPhase phase;

    public Optional<AppointmentOption> selected() {
        if (selectedAppointmentId == null) return Optional.empty();
        return appointments.stream().filter(a -> selectedAppointmentId.equals(a.id())).findFirst();
    }

    public record AppointmentOption(UUID id, UUID doctorId, String doctorName, UUID calendarId,
                                    LocalDate date, LocalTime time, int durationMinutes) {
    }
}
