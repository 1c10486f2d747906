package com.couchapp.couch.domain.schedule;

import com.couchapp.couch.domain.show.Show;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(
        name = "scheduled_episode",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_scheduled_episode_day_show_ep",
                        columnNames = {"schedule_day_id", "show_id", "season", "episode"}
                )
        },
        indexes = {
                @Index(name = "ix_scheduled_episode_day", columnList = "schedule_day_id"),
                @Index(name = "ix_scheduled_episode_show", columnList = "show_id")
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledEpisode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "schedule_day_id", nullable = false)
    private ScheduleDay scheduleDay;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "show_id", nullable = false)
    private Show show;

    @Column(nullable = false)
    private Integer season;

    @Column(nullable = false)
    private Integer episode;

    @Column(nullable = false)
    private Integer runtime;

    @Column(name = "sort_order", nullable = false)
    private Integer position;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    @Builder.Default
    private EpisodeStatus status = EpisodeStatus.PENDING;
}
