package com.ai.clinicbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "faq_entry", indexes = {
    @Index(name = "idx_faq_org", columnList = "organization_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FaqEntry {

    public static final int SCOPE_DOCTOR = 1;
    public static final int SCOPE_CLINIC = 2;
    public static final int SCOPE_ORGANIZATION = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Column(name = "clinic_id")
    private UUID clinicId;

    @Column(name = "doctor_id")
    private UUID doctorId;

    /** 1 = doctor, 2 = clinic, 3 = organization. Lower wins on equal score. */
    @Column(name = "scope_priority", nullable = false)
    private int scopePriority;

    @Column(nullable = false, length = 500)
    private String question;

    @Column(nullable = false, length = 2000)
    private String answer;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "faq_keyword", joinColumns = @JoinColumn(name = "faq_id"))
    @Column(name = "keyword", length = 100)
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;
}
