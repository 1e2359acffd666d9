package com.commutematch.repository;

import com.commutematch.entity.TripMatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TripMatchRepository extends JpaRepository<TripMatch, Long> {
    Optional<TripMatch> findByForTripId(String forTripId);
}
