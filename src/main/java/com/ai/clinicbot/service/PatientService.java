package com.ai.clinicbot.service;

import com.ai.clinicbot.entity.Patient;
import com.ai.clinicbot.repository.PatientRepository;
import com.ai.clinicbot.utils.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Patient lookup by phone. Records may store the number in E.164 or as the local
 * eight digits, so every lookup tries all variants.
 */
@Service
public class PatientService {

    private static final Logger log = LoggerFactory.getLogger(PatientService.class);

    private final PatientRepository patientRepository;

    public PatientService(PatientRepository patientRepository) {
        this.patientRepository = patientRepository;
    }

    @Transactional(readOnly = true)
    public List<Patient> findAllByPhone(String phone, UUID organizationId) {
        var variants = PhoneNumbers.lookupVariants(phone);
        if (variants.isEmpty()) return List.of();
        return patientRepository.findByPhoneInOrderByCreatedAtAsc(variants).stream()
                .filter(p -> organizationId == null || p.getOrganizationId() == null
                        || organizationId.equals(p.getOrganizationId()))
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Patient> findByPhone(String phone, UUID organizationId) {
        return findAllByPhone(phone, organizationId).stream().findFirst();
    }

    /** Minimal record collected by the bot: name and phone only. */
    @Transactional
    public Patient createMinimal(String name, String phone, UUID organizationId) {
        Patient patient = patientRepository.save(Patient.builder()
                .name(name.trim())
                .phone(PhoneNumbers.normalizeToE164(phone))
                .organizationId(organizationId)
                .build());
        log.info("Created patient {} from chat", patient.getId());
        return patient;
    }
}
