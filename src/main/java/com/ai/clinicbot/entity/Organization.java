package com.ai.clinicbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "organization")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Organization {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 150)
    private String name;

    /** Kill switch: when false every outbound message for this tenant is blocked. */
    @Column(name = "messaging_enabled", nullable = false)
    @Builder.Default
    private boolean messagingEnabled = true;
}
