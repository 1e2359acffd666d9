package com.commutematch.repository;

import com.commutematch.entity.Trip;
import com.commutematch.matching.model.TripStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface TripRepository extends JpaRepository<Trip, String> {
    @Query("SELECT t FROM Trip t WHERE t.status = :status AND t.departTime < :threshold")
    List<Trip> findByStatusAndDepartTimeBefore(@Param("status") TripStatus status, @Param("threshold") Instant threshold);
}
