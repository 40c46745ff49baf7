package com.runsmart.garmin_sync_engine.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * One raw row received from Garmin, exactly as delivered. Append-only.
 */
@Entity
@Table(name = "garmin_export_records")
@Data
public class GarminExportRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "garmin_user_id", nullable = false)
    private String garminUserId;

    @Column(name = "dataset_key", nullable = false)
    private String datasetKey;

    @Column(name = "summary_id", nullable = false)
    private String summaryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExportSource source;

    @Column(name = "recorded_at")
    private Instant recordedAt;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> payload;

    public enum ExportSource {
        PUSH, PING_PULL, API_PULL;

        public String wireName() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }
}
