package com.runsmart.garmin_sync_engine.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Read side of {@code garmin_activities}. Writes go through {@code GarminAnalyticsRepository}.
 */
@Entity
@Table(name = "garmin_activities",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "activity_id"}))
@Data
public class GarminActivity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "activity_id", nullable = false)
    private String activityId;

    @Column(name = "start_time")
    private Instant startTime;

    private String sport;

    @Column(name = "duration_s")
    private Integer durationS;

    @Column(name = "distance_m")
    private Double distanceM;

    @Column(name = "avg_hr")
    private Integer avgHr;

    @Column(name = "max_hr")
    private Integer maxHr;

    /** Seconds per kilometre. */
    @Column(name = "avg_pace")
    private Integer avgPace;

    @Column(name = "elevation_gain_m")
    private Double elevationGainM;

    private Double calories;

    private String source;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_json", columnDefinition = "jsonb")
    private Map<String, Object> rawJson;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
