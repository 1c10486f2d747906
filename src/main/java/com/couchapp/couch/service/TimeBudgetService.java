package com.couchapp.couch.service;

import com.couchapp.couch.domain.planning.Weekdays;
import com.couchapp.couch.domain.settings.Settings;
import com.couchapp.couch.repository.SettingsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * Minutes available on a weekday: a per-weekday override when set, otherwise the weekend
 * default for Saturday/Sunday and the weekday default for the rest.
 */
@Service
@RequiredArgsConstructor
public class TimeBudgetService {

    private final SettingsRepository settingsRepository;

    @Transactional(readOnly = true)
    public Settings currentSettings() {
        return settingsRepository.findById(Settings.SINGLETON_ID)
                .orElseGet(Settings::defaults);
    }

    @Transactional(readOnly = true)
    public int minutesForWeekday(int weekday) {
        return resolve(currentSettings(), weekday);
    }

    @Transactional(readOnly = true)
    public int minutesForDate(LocalDate date) {
        return minutesForWeekday(Weekdays.of(date));
    }

    public static int resolve(Settings settings, int weekday) {
        Integer override = settings.overrideFor(weekday);
        if (override != null) return override;

        Integer fallback = Weekdays.isWeekend(weekday)
                ? settings.getWeekendMinutes()
                : settings.getWeekdayMinutes();

        if (fallback != null) return fallback;
        return Weekdays.isWeekend(weekday)
                ? Settings.DEFAULT_WEEKEND_MINUTES
                : Settings.DEFAULT_WEEKDAY_MINUTES;
    }
}
