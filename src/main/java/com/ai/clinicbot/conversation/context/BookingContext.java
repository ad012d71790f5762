package com.ai.clinicbot.conversation.context;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
public final class BookingContext extends FlowContext {

    private List<DoctorOption> doctorOptions = new ArrayList<>();
    private UUID doctorId;
    private String doctorName;
    private UUID calendarId;
    private int durationMinutes;

    private List<LocalDate> weekStarts = new ArrayList<>();
    private LocalDate weekStart;
    private List<LocalDate> days = new ArrayList<>();
    private LocalDate date;
    private List<LocalTime> hours = new ArrayList<>();
    private int hourPage;
    private LocalTime time;

    private boolean reschedule;
    private UUID rescheduleAppointmentId;

    public void selectDoctor(DoctorOption doctor) {
        this.doctorId = doctor.id();
        this.doctorName = doctor.name();
        this.calendarId = doctor.calendarId();
    }

    public void clearHours() {
        this.hours = new ArrayList<>();
        this.hourPage = 0;
        this.time = null;
    }

    public record DoctorOption(UUID id, String name, UUID calendarId) {
    }
}
