package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.LineDoctor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LineDoctorRepository extends JpaRepository<LineDoctor, UUID> {
    List<LineDoctor> findByLineIdOrderByDisplayOrderAsc(UUID lineId);
}
