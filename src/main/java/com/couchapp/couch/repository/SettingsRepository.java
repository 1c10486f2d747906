package com.couchapp.couch.repository;

import com.couchapp.couch.domain.settings.Settings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SettingsRepository extends JpaRepository<Settings, Long> {
}
