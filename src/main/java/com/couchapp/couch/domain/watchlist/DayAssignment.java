package com.couchapp.couch.domain.watchlist;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(
        name = "day_assignment",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_assignment_entry_weekday", columnNames = {"watchlist_entry_id", "weekday"})
        },
        indexes = {
                @Index(name = "ix_assignment_weekday", columnList = "weekday")
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DayAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "watchlist_entry_id", nullable = false)
    private WatchlistEntry watchlistEntry;

    // 0 = Sunday .. 6 = Saturday
    @Column(name = "weekday", nullable = false)
    private Integer weekday;
}
