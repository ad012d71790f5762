package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AppointmentRepository extends JpaRepository<Appointment, UUID> {

    List<Appointment> findByDoctorIdInAndDateAndStatusNot(Collection<UUID> doctorIds, LocalDate date, Appointment.Status status);

    List<Appointment> findByPatientIdInAndDateGreaterThanEqualAndStatusInOrderByDateAscTimeAsc(
            Collection<UUID> patientIds, LocalDate from, Collection<Appointment.Status> statuses);

    List<Appointment> findByDateAndStatusInAndReminderSentAtIsNullOrderByTimeAsc(
            LocalDate date, Collection<Appointment.Status> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") UUID id);
}
