package com.ai.clinicbot.entity;

import jakarta.persistence.*;
import lombok.*;
import org.apache.commons.lang3.StringUtils;

import java.util.UUID;

@Entity
@Table(name = "doctor", indexes = {
    @Index(name = "idx_doctor_calendar", columnList = "calendar_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Doctor {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organization_id")
    private UUID organizationId;

    @Column(name = "clinic_id")
    private UUID clinicId;

    /** Shared booking calendar; doctors on the same calendar share one clock. */
    @Column(name = "calendar_id")
    private UUID calendarId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 20)
    private String prefix;

    @Column(length = 30)
    private String phone;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    public String displayName() {
        return StringUtils.isNotBlank(prefix) ? prefix + " " + name : "Dr. " + name;
    }
}
