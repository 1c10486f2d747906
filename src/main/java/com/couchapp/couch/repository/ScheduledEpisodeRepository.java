package com.couchapp.couch.repository;

import com.couchapp.couch.domain.schedule.EpisodeStatus;
import com.couchapp.couch.domain.schedule.ScheduledEpisode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface ScheduledEpisodeRepository extends JpaRepository<ScheduledEpisode, Long> {

    @Query("""
            select e from ScheduledEpisode e
            join fetch e.show s
            where e.scheduleDay.id = :dayId
            order by e.position asc
            """)
    List<ScheduledEpisode> findForDay(@Param("dayId") Long scheduleDayId);

    @Query("""
            select e from ScheduledEpisode e
            join fetch e.show s
            join fetch e.scheduleDay d
            where e.status = :status and d.date between :start and :end
            order by d.date asc, e.position asc
            """)
    List<ScheduledEpisode> findByStatusBetween(@Param("status") EpisodeStatus status,
                                               @Param("start") LocalDate start,
                                               @Param("end") LocalDate end);

    @Query("""
            select e from ScheduledEpisode e
            join fetch e.show s
            where e.status = :status
            """)
    List<ScheduledEpisode> findAllByStatus(@Param("status") EpisodeStatus status);

    @Modifying(flushAutomatically = true)
    @Query("delete from ScheduledEpisode e where e.scheduleDay.id = :dayId")
    int deleteForDay(@Param("dayId") Long scheduleDayId);

    @Query("""
            select e from ScheduledEpisode e
            join fetch e.show s
            join fetch e.scheduleDay d
            where e.status = :status and d.date >= :start
            """)
    List<ScheduledEpisode> findByStatusFrom(@Param("status") EpisodeStatus status,
                                            @Param("start") LocalDate start);

    @Modifying(flushAutomatically = true)
    @Query("""
            delete from ScheduledEpisode e
            where e.scheduleDay.id in (select d.id from ScheduleDay d where d.date > :date)
            """)
    int deleteAfter(@Param("date") LocalDate date);
}
