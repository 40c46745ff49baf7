package com.runsmart.garmin_sync_engine.repository;

import com.runsmart.garmin_sync_engine.model.GarminActivity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface GarminActivityRepository extends JpaRepository<GarminActivity, Long> {

    @Query("""
        SELECT a FROM GarminActivity a
        WHERE a.userId = :userId
          AND a.startTime >= :from
          AND a.startTime < :to
        ORDER BY a.startTime ASC
        """)
    List<GarminActivity> findWindow(@Param("userId") Long userId,
                                    @Param("from") Instant from,
                                    @Param("to") Instant to);
}
