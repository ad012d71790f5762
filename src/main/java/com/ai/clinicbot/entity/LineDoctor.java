package com.ai.clinicbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/** Doctors a line books for. One line may serve many doctors. */
@Entity
@Table(name = "line_doctor", uniqueConstraints = {
    @UniqueConstraint(name = "uk_line_doctor", columnNames = {"line_id", "doctor_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LineDoctor {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "line_id", nullable = false)
    private UUID lineId;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "doctor_id", nullable = false)
    private Doctor doctor;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;
}
