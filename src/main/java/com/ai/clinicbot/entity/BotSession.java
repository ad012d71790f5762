package com.ai.clinicbot.entity;

import com.ai.clinicbot.conversation.ConversationState;
import com.ai.clinicbot.conversation.context.ConversationContext;
import com.ai.clinicbot.conversation.context.ConversationContextConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted conversation for one patient phone on one line.
 * Unique on (line_id, patient_phone) so concurrent first messages converge on one row.
 */
@Entity
@Table(name = "bot_session", uniqueConstraints = {
    @UniqueConstraint(name = "uk_bot_session_line_phone", columnNames = {"line_id", "patient_phone"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BotSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "line_id", nullable = false)
    private UUID lineId;

    @Column(name = "patient_phone", nullable = false, length = 30)
    private String patientPhone;

    @Column(name = "organization_id")
    private UUID organizationId;

    @Convert(converter = ConversationStateConverter.class)
    @Column(nullable = false, length = 40)
    @Builder.Default
    private ConversationState state = ConversationState.GREETING;

    @Convert(converter = ConversationContextConverter.class)
    @Column(name = "context_json", length = 8000)
    @Builder.Default
    private ConversationContext context = new ConversationContext();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
