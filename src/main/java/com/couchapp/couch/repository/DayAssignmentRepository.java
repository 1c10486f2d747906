package com.couchapp.couch.repository;

import com.couchapp.couch.domain.watchlist.DayAssignment;
import com.couchapp.couch.domain.watchlist.WatchlistStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface DayAssignmentRepository extends JpaRepository<DayAssignment, Long> {

    /**
     * Assignments on a weekday whose entry has the given status, in entry priority order.
     */
    @Query("""
            select a from DayAssignment a
            join fetch a.watchlistEntry e
            join fetch e.show s
            where a.weekday = :weekday and e.status = :status
            order by e.priority asc, e.id asc
            """)
    List<DayAssignment> findForWeekday(@Param("weekday") Integer weekday,
                                       @Param("status") WatchlistStatus status);

    @Query("""
            select a from DayAssignment a
            join fetch a.watchlistEntry e
            join fetch e.show s
            where e.status = :status
            """)
    List<DayAssignment> findAllWithStatus(@Param("status") WatchlistStatus status);
}
