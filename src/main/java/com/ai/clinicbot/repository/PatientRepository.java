package com.ai.clinicbot.repository;

import com.ai.clinicbot.entity.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface PatientRepository extends JpaRepository<Patient, UUID> {
    List<Patient> findByPhoneInOrderByCreatedAtAsc(Collection<String> phones);
}
