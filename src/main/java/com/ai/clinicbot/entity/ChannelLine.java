package com.ai.clinicbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A WhatsApp number owned by an organization. The provider decides which
 * adapter sends for it and how logical message types resolve to templates.
 */
@Entity
@Table(name = "channel_line", indexes = {
    @Index(name = "idx_channel_line_org", columnList = "organization_id"),
    @Index(name = "idx_channel_line_meta_phone", columnList = "meta_phone_number_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChannelLine {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organization_id")
    private UUID organizationId;

    @Column(length = 100)
    private String label;

    @Column(name = "phone_number", nullable = false, length = 30)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MessagingProviderType provider;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "bot_enabled", nullable = false)
    private boolean botEnabled;

    @Column(name = "bot_greeting", length = 1000)
    private String botGreeting;

    @Column(name = "default_duration_minutes")
    private Integer defaultDurationMinutes;

    // Twilio
    @Column(name = "twilio_account_sid", length = 64)
    private String twilioAccountSid;

    @Column(name = "twilio_auth_token", length = 128)
    private String twilioAuthToken;

    @Column(name = "twilio_phone_from", length = 40)
    private String twilioPhoneFrom;

    @Column(name = "twilio_messaging_service_sid", length = 64)
    private String twilioMessagingServiceSid;

    // Meta
    @Column(name = "meta_waba_id", length = 64)
    private String metaWabaId;

    @Column(name = "meta_phone_number_id", length = 64)
    private String metaPhoneNumberId;

    @Column(name = "meta_access_token", length = 512)
    private String metaAccessToken;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
