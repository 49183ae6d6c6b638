package com.storeforecast.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(
    name = "calendar_events",
    indexes = {
        @Index(name = "idx_event_date", columnList = "event_date"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalendarEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_date", nullable = false)
    private LocalDate eventDate;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(name = "event_type", nullable = false, length = 50)
    private String type;

    @Column(name = "impact_weight")
    private Double impactWeight;

    /** {@code accepted}, {@code rejected} or null when undecided. */
    @Column(name = "user_decision", length = 20)
    private String userDecision;
}
