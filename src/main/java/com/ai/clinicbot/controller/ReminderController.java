package com.ai.clinicbot.controller;

import com.ai.clinicbot.dto.ReminderRunResult;
import com.ai.clinicbot.service.ReminderService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/reminders")
public class ReminderController {

    private final ReminderService reminderService;

    public ReminderController(ReminderService reminderService) {
        this.reminderService = reminderService;
    }

    @PostMapping("/run")
    public ReminderRunResult run() {
        return reminderService.sendTomorrowReminders();
    }
}
