package com.runsmart.garmin_sync_engine.repository;

import com.runsmart.garmin_sync_engine.model.GarminDailyMetric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface GarminDailyMetricRepository extends JpaRepository<GarminDailyMetric, Long> {
    List<GarminDailyMetric> findByUserIdAndDateBetweenOrderByDateAsc(Long userId, LocalDate from, LocalDate to);
}
