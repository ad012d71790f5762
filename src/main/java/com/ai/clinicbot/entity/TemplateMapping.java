package com.ai.clinicbot.entity;

import com.ai.clinicbot.messaging.MessageType;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/** Per-line, per-provider mapping of a logical message type to a concrete template. */
@Entity
@Table(name = "template_mapping", indexes = {
    @Index(name = "idx_template_mapping_lookup", columnList = "line_id, logical_type, provider")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TemplateMapping {

    public enum ApprovalStatus { APPROVED, PENDING, REJECTED }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "line_id", nullable = false)
    private UUID lineId;

    @Enumerated(EnumType.STRING)
    @Column(name = "logical_type", nullable = false, length = 30)
    private MessageType logicalType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MessagingProviderType provider;

    /** Meta template name, or Twilio content SID. */
    @Column(name = "template_name", nullable = false, length = 100)
    private String templateName;

    @Column(name = "template_language", length = 10)
    @Builder.Default
    private String templateLanguage = "es";

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", nullable = false, length = 20)
    @Builder.Default
    private ApprovalStatus approvalStatus = ApprovalStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;
}
