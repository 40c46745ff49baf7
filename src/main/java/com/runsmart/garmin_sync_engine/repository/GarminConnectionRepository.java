package com.runsmart.garmin_sync_engine.repository;

import com.runsmart.garmin_sync_engine.model.GarminConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GarminConnectionRepository extends JpaRepository<GarminConnection, Long> {
    List<GarminConnection> findByGarminUserId(String garminUserId);

    List<GarminConnection> findByStatus(GarminConnection.ConnectionStatus status);
}
