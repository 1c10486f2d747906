package com.couchapp.couch.domain.planning;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class WeekdaysTest {

    @Test
    void of_MapsSundayToZero() {
        assertThat(Weekdays.of(DayOfWeek.SUNDAY)).isEqualTo(0);
        assertThat(Weekdays.of(DayOfWeek.MONDAY)).isEqualTo(1);
        assertThat(Weekdays.of(DayOfWeek.SATURDAY)).isEqualTo(6);
        assertThat(Weekdays.of(LocalDate.of(2026, 10, 18))).isEqualTo(Weekdays.SUNDAY);
    }

    @Test
    void isWeekend_OnlySaturdayAndSunday() {
        assertThat(Weekdays.isWeekend(0)).isTrue();
        assertThat(Weekdays.isWeekend(6)).isTrue();
        assertThat(Weekdays.isWeekend(3)).isFalse();
    }

    @Test
    void sanitize_DropsInvalidAndDuplicates() {
        assertThat(Weekdays.sanitize(Arrays.asList(5, 1, 1, 7, -1, null, 0)))
                .containsExactly(0, 1, 5);
        assertThat(Weekdays.sanitize(null)).isEmpty();
    }
}
