package com.ai.clinicbot.service;

import com.ai.clinicbot.entity.FaqEntry;
import com.ai.clinicbot.repository.FaqEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FaqMatcherServiceTest {

    private static final UUID ORG = UUID.randomUUID();
    private static final UUID DOCTOR = UUID.randomUUID();
    private static final UUID CLINIC = UUID.randomUUID();

    @Mock
    private FaqEntryRepository repository;

    private FaqMatcherService service;

    @BeforeEach
    void setUp() {
        service = new FaqMatcherService(repository);
    }

    @Test
    void doctorEntryWinsTieOverOrganizationEntry() {
        FaqEntry doctorEntry = entry(FaqEntry.SCOPE_DOCTOR, DOCTOR, null, "¿Cuál es el precio de la consulta?", "precio");
        FaqEntry orgEntry = entry(FaqEntry.SCOPE_ORGANIZATION, null, null, "¿Cuál es el precio de la consulta?", "precio");
        when(repository.findByOrganizationIdAndActiveTrueOrderByScopePriorityAscDisplayOrderAsc(ORG))
                .thenReturn(List.of(orgEntry, doctorEntry));

        Optional<FaqMatcherService.FaqMatch> match = service.search("precio de la consulta", ORG, DOCTOR, null);

        assertTrue(match.isPresent());
        assertEquals(doctorEntry, match.get().entry());
    }

    @Test
    void higherScoreBeatsNarrowerScope() {
        FaqEntry doctorEntry = entry(FaqEntry.SCOPE_DOCTOR, DOCTOR, null, "Horario", "horario");
        FaqEntry orgEntry = entry(FaqEntry.SCOPE_ORGANIZATION, null, null, "¿Aceptan seguro médico?", "seguro", "aseguradora");
        when(repository.findByOrganizationIdAndActiveTrueOrderByScopePriorityAscDisplayOrderAsc(ORG))
                .thenReturn(List.of(doctorEntry, orgEntry));

        Optional<FaqMatcherService.FaqMatch> match = service.search("aceptan seguro de la aseguradora", ORG, DOCTOR, null);

        assertEquals(orgEntry, match.orElseThrow().entry());
    }

    @Test
    void entriesForOtherDoctorsOrClinicsAreIgnored() {
        FaqEntry otherDoctor = entry(FaqEntry.SCOPE_DOCTOR, UUID.randomUUID(), null, "Parqueo", "parqueo");
        FaqEntry otherClinic = entry(FaqEntry.SCOPE_CLINIC, null, UUID.randomUUID(), "Parqueo", "parqueo");
        when(repository.findByOrganizationIdAndActiveTrueOrderByScopePriorityAscDisplayOrderAsc(ORG))
                .thenReturn(List.of(otherDoctor, otherClinic));

        assertTrue(service.search("hay parqueo?", ORG, DOCTOR, CLINIC).isEmpty());
    }

    @Test
    void clinicEntryMatchesItsClinic() {
        FaqEntry clinicEntry = entry(FaqEntry.SCOPE_CLINIC, null, CLINIC, "¿Dónde queda la clínica?", "direccion", "ubicacion");
        when(repository.findByOrganizationIdAndActiveTrueOrderByScopePriorityAscDisplayOrderAsc(ORG))
                .thenReturn(List.of(clinicEntry));

        assertEquals(clinicEntry, service.search("Dirección", ORG, null, CLINIC).orElseThrow().entry());
    }

    @Test
    void noScoreNoMatch() {
        when(repository.findByOrganizationIdAndActiveTrueOrderByScopePriorityAscDisplayOrderAsc(ORG))
                .thenReturn(List.of(entry(FaqEntry.SCOPE_ORGANIZATION, null, null, "Horario", "horario")));

        assertTrue(service.search("xyz", ORG, null, null).isEmpty());
    }

    @Test
    void blankQueryDoesNotHitTheRepository() {
        assertTrue(service.search("   ", ORG, null, null).isEmpty());
        verifyNoInteractions(repository);
    }

    @Test
    void keywordsCountDoubleQuestionWords() {
        FaqEntry faq = entry(FaqEntry.SCOPE_ORGANIZATION, null, null, "Horario de atención", "horario");
        assertEquals(1.5, FaqMatcherService.score(FaqMatcherService.normalize("Cuál es el HORARIO"), faq));
    }

    private static FaqEntry entry(int scope, UUID doctorId, UUID clinicId, String question, String... keywords) {
        return FaqEntry.builder()
                .id(UUID.randomUUID())
                .organizationId(ORG)
                .doctorId(doctorId)
                .clinicId(clinicId)
                .scopePriority(scope)
                .question(question)
                .answer("respuesta")
                .keywords(new ArrayList<>(List.of(keywords)))
                .build();
    }
}
