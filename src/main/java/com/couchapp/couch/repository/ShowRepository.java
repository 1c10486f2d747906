package com.couchapp.couch.repository;

import com.couchapp.couch.domain.show.Show;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ShowRepository extends JpaRepository<Show, Long> {

    Optional<Show> findByCatalogId(Long catalogId);
}
