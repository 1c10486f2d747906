package com.couchapp.couch.repository;

import com.couchapp.couch.domain.schedule.ScheduleDay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Optional;

public interface ScheduleDayRepository extends JpaRepository<ScheduleDay, Long> {

    Optional<ScheduleDay> findByDate(LocalDate date);

    long countByDateBetween(LocalDate start, LocalDate end);

    @Modifying(flushAutomatically = true)
    @Query("delete from ScheduleDay d where d.date > :date")
    int deleteAfter(@Param("date") LocalDate date);
}
