package com.couchapp.couch.domain.schedule;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Generated plan for one calendar date. Rebuilt from watchlist positions, day assignments and
 * settings whenever the schedule is regenerated; its episodes live in {@link ScheduledEpisode}.
 */
@Entity
@Table(
        name = "schedule_day",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_schedule_day_date", columnNames = {"schedule_date"})
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleDay {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "schedule_date", nullable = false)
    private LocalDate date;

    @Column(name = "planned_minutes", nullable = false)
    private Integer plannedMinutes;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        generatedAt = Instant.now();
    }
}
