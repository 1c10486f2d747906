package com.couchapp.couch.repository;

import com.couchapp.couch.domain.watchlist.WatchlistEntry;
import com.couchapp.couch.domain.watchlist.WatchlistStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface WatchlistEntryRepository extends JpaRepository<WatchlistEntry, Long> {

    List<WatchlistEntry> findAllByOrderByPriorityAscIdAsc();

    List<WatchlistEntry> findByStatusOrderByPriorityAscIdAsc(WatchlistStatus status);

    Optional<WatchlistEntry> findByShow_Id(Long showId);

    boolean existsByShow_Id(Long showId);
}
