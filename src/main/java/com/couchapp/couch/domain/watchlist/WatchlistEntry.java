package com.couchapp.couch.domain.watchlist;

import com.couchapp.couch.domain.settings.SchedulingMode;
import com.couchapp.couch.domain.show.Show;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@Entity
@Table(
        name = "watchlist_entry",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_watchlist_show", columnNames = {"show_id"})
        },
        indexes = {
                @Index(name = "ix_watchlist_status", columnList = "status"),
                @Index(name = "ix_watchlist_priority", columnList = "priority")
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WatchlistEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.EAGER)
    @JoinColumn(name = "show_id", nullable = false)
    private Show show;

    @Column(nullable = false)
    @Builder.Default
    private Integer priority = 0;

    @Column(name = "start_season", nullable = false)
    @Builder.Default
    private Integer startSeason = 1;

    @Column(name = "start_episode", nullable = false)
    @Builder.Default
    private Integer startEpisode = 1;

    @Column(name = "current_season", nullable = false)
    private Integer currentSeason;

    @Column(name = "current_episode", nullable = false)
    private Integer currentEpisode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    @Builder.Default
    private WatchlistStatus status = WatchlistStatus.QUEUED;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode_override", length = 12)
    private SchedulingMode modeOverride;

    @OneToMany(mappedBy = "watchlistEntry", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("weekday ASC")
    @Builder.Default
    private List<DayAssignment> dayAssignments = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (currentSeason == null) currentSeason = startSeason;
        if (currentEpisode == null) currentEpisode = startEpisode;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isQueued() {
        return status == WatchlistStatus.QUEUED;
    }

    public boolean isWatching() {
        return status == WatchlistStatus.WATCHING;
    }

    public Set<Integer> assignedWeekdays() {
        Set<Integer> days = new TreeSet<>();
        for (DayAssignment a : dayAssignments) {
            days.add(a.getWeekday());
        }
        return days;
    }

    /**
     * Makes the assignment set equal to {@code weekdays}. Rows already present are kept so the
     * unique (entry, weekday) key is never inserted twice within one flush.
     */
    public void replaceWeekdays(Collection<Integer> weekdays) {
        Set<Integer> wanted = new TreeSet<>(weekdays);
        dayAssignments.removeIf(a -> !wanted.contains(a.getWeekday()));

        Set<Integer> present = assignedWeekdays();
        for (Integer day : wanted) {
            if (present.contains(day)) continue;
            dayAssignments.add(DayAssignment.builder()
                    .watchlistEntry(this)
                    .weekday(day)
                    .build());
        }
    }

    public void clearWeekdays() {
        dayAssignments.clear();
    }
}
