package com.ai.clinicbot.dto;

import java.time.LocalDate;

public record ReminderRunResult(boolean ok, LocalDate date, int total, int sent, int failed, int skipped) {
}
