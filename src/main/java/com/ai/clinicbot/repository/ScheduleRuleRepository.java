package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.ScheduleRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ScheduleRuleRepository extends JpaRepository<ScheduleRule, UUID> {

    List<ScheduleRule> findByDoctorIdAndDayOfWeekOrderByStartTimeAsc(UUID doctorId, int dayOfWeek);

    List<ScheduleRule> findByCalendarIdAndDayOfWeekOrderByStartTimeAsc(UUID calendarId, int dayOfWeek);
}
