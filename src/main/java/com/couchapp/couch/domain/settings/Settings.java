package com.couchapp.couch.domain.settings;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "settings")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Settings {

    public static final long SINGLETON_ID = 1L;
    public static final int DEFAULT_WEEKDAY_MINUTES = 120;
    public static final int DEFAULT_WEEKEND_MINUTES = 240;

    @Id
    @Builder.Default
    private Long id = SINGLETON_ID;

    @Column(name = "weekday_minutes", nullable = false)
    @Builder.Default
    private Integer weekdayMinutes = DEFAULT_WEEKDAY_MINUTES;

    @Column(name = "weekend_minutes", nullable = false)
    @Builder.Default
    private Integer weekendMinutes = DEFAULT_WEEKEND_MINUTES;

    @Column(name = "sunday_minutes")
    private Integer sundayMinutes;

    @Column(name = "monday_minutes")
    private Integer mondayMinutes;

    @Column(name = "tuesday_minutes")
    private Integer tuesdayMinutes;

    @Column(name = "wednesday_minutes")
    private Integer wednesdayMinutes;

    @Column(name = "thursday_minutes")
    private Integer thursdayMinutes;

    @Column(name = "friday_minutes")
    private Integer fridayMinutes;

    @Column(name = "saturday_minutes")
    private Integer saturdayMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "scheduling_mode", nullable = false, length = 12)
    @Builder.Default
    private SchedulingMode schedulingMode = SchedulingMode.SEQUENTIAL;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }

    public static Settings defaults() {
        return Settings.builder().build();
    }

    /**
     * Override for a weekday (0 = Sunday .. 6 = Saturday), or null when the weekday/weekend
     * default applies.
     */
    public Integer overrideFor(int weekday) {
        return switch (weekday) {
            case 0 -> sundayMinutes;
            case 1 -> mondayMinutes;
            case 2 -> tuesdayMinutes;
            case 3 -> wednesdayMinutes;
            case 4 -> thursdayMinutes;
            case 5 -> fridayMinutes;
            case 6 -> saturdayMinutes;
            default -> throw new IllegalArgumentException("weekday must be 0..6: " + weekday);
        };
    }
}
