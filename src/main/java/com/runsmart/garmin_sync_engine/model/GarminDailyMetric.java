package com.runsmart.garmin_sync_engine.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

@Entity
@Table(name = "garmin_daily_metrics",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "date"}))
@Data
public class GarminDailyMetric {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false)
    private LocalDate date;

    private Integer steps;

    @Column(name = "sleep_score")
    private Double sleepScore;

    @Column(name = "sleep_duration_s")
    private Integer sleepDurationS;

    private Double hrv;

    @Column(name = "resting_hr")
    private Integer restingHr;

    private Double stress;

    @Column(name = "body_battery")
    private Integer bodyBattery;

    @Column(name = "training_readiness")
    private Integer trainingReadiness;

    private Double vo2max;

    @Column(name = "weight_kg")
    private Double weightKg;

    private Double calories;

    /** Source payloads keyed by dataset, e.g. {@code {"sleeps": {...}, "dailies": {...}}}. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_json", columnDefinition = "jsonb")
    private Map<String, Object> rawJson;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
