package com.ai.clinicbot.entity;

import com.ai.clinicbot.messaging.MessageType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "message_log", indexes = {
    @Index(name = "idx_message_log_to_phone", columnList = "to_phone"),
    @Index(name = "idx_message_log_appointment", columnList = "appointment_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_message_log_provider_id", columnNames = "provider_message_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageLog {

    public enum Direction { INBOUND, OUTBOUND }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Direction direction;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String channel = "whatsapp";

    @Column(name = "to_phone", length = 40)
    private String toPhone;

    @Column(name = "from_phone", length = 40)
    private String fromPhone;

    @Column(length = 4000)
    private String body;

    @Column(name = "template_name", length = 100)
    private String templateName;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private MessageType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryStatus status;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private MessagingProviderType provider;

    @Column(name = "provider_message_id", length = 128)
    private String providerMessageId;

    @Column(name = "appointment_id")
    private UUID appointmentId;

    @Column(name = "patient_id")
    private UUID patientId;

    @Column(name = "doctor_id")
    private UUID doctorId;

    @Column(name = "organization_id")
    private UUID organizationId;

    @Column(name = "line_id")
    private UUID lineId;

    @Column(name = "error_code", length = 64)
    private String errorCode;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
