package com.ai.clinicbot.utils;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Patient-facing date and time formats: dd/MM/yyyy, 12-hour clock, Spanish day names.
 */
public final class AppointmentFormats {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("dd/MM");
    private static final String[] DAY_NAMES = {
            "Lunes", "Martes", "Miércoles", "Jueves", "Viernes", "Sábado", "Domingo"
    };

    private AppointmentFormats() {
    }

    public static String date(LocalDate date) {
        return date.format(DATE);
    }

    public static String shortDate(LocalDate date) {
        return date.format(SHORT_DATE);
    }

    /** 15:00 becomes "3:00 PM", 00:30 becomes "12:30 AM". */
    public static String time(LocalTime time) {
        int hour12 = time.getHour() % 12 == 0 ? 12 : time.getHour() % 12;
        String period = time.getHour() >= 12 ? "PM" : "AM";
        return String.format("%d:%02d %s", hour12, time.getMinute(), period);
    }

    public static String dateTime(LocalDate date, LocalTime time) {
        return date(date) + " a las " + time(time);
    }

    public static String dayName(DayOfWeek day) {
        return DAY_NAMES[day.getValue() - 1];
    }

    /** "Martes 14/01". */
    public static String dayLabel(LocalDate date) {
        return dayName(date.getDayOfWeek()) + " " + shortDate(date);
    }

    public static String weekLabel(LocalDate monday) {
        return "Semana del " + shortDate(monday) + " al " + shortDate(monday.plusDays(6));
    }

    /** Schedule storage numbering: 0 = Sunday ... 6 = Saturday. */
    public static int scheduleDayOfWeek(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }
}
