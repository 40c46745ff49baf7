package com.runsmart.garmin_sync_engine.repository;

import com.runsmart.garmin_sync_engine.model.GarminExportRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface GarminExportRecordRepository extends JpaRepository<GarminExportRecord, String> {
    List<GarminExportRecord> findByGarminUserIdAndReceivedAtGreaterThanEqualOrderByReceivedAtDesc(
            String garminUserId, Instant since, Pageable pageable);
}
