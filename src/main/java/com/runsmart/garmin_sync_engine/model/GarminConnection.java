package com.runsmart.garmin_sync_engine.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * OAuth state of one app user's Garmin link. Rows are never deleted; disconnecting wipes the
 * tokens and flips the status.
 */
@Entity
@Table(name = "garmin_connections")
@Data
public class GarminConnection {
    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "garmin_user_id")
    private String garminUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;

    @Column(name = "access_token", columnDefinition = "TEXT")
    private String accessToken;

    @Column(name = "refresh_token", columnDefinition = "TEXT")
    private String refreshToken;

    @Column(name = "token_expires_at")
    private Instant tokenExpiresAt;

    @Column(columnDefinition = "TEXT")
    private String scopes;

    @Column(name = "connected_at")
    private Instant connectedAt;

    @Column(name = "last_sync_at")
    private Instant lastSyncAt;

    @Column(name = "last_sync_cursor")
    private Instant lastSyncCursor;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_state", columnDefinition = "jsonb")
    private Map<String, Object> errorState;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    public boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }

    public enum ConnectionStatus {
        CONNECTED, DISCONNECTED, ERROR
    }
}
