package com.runsmart.garmin_sync_engine.service;

import com.runsmart.garmin_sync_engine.exception.GarminAuthException;
import com.runsmart.garmin_sync_engine.model.GarminConnection;
import com.runsmart.garmin_sync_engine.repository.GarminConnectionRepository;
import com.runsmart.garmin_sync_engine.util.EncryptionUtil;
import com.runsmart.garmin_sync_engine.util.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns {@link GarminConnection} rows: encrypted tokens, connection status and sync bookkeeping.
 */
@Service
public class GarminTokenStore {
    private static final Logger logger = LoggerFactory.getLogger(GarminTokenStore.class);

    /** Access tokens expiring sooner than this are refreshed before use. */
    static final Duration REFRESH_SKEW = Duration.ofMinutes(5);

    private final GarminConnectionRepository connectionRepository;
    private final GarminOAuthClient oauthClient;
    private final EncryptionUtil encryptionUtil;
    private final Clock clock;

    public GarminTokenStore(GarminConnectionRepository connectionRepository,
                            GarminOAuthClient oauthClient,
                            EncryptionUtil encryptionUtil,
                            Clock clock) {
        this.connectionRepository = connectionRepository;
        this.oauthClient = oauthClient;
        this.encryptionUtil = encryptionUtil;
        this.clock = clock;
    }

    public Optional<GarminConnection> get(Long userId) {
        return connectionRepository.findById(userId);
    }

    /**
     * Stores the tokens from a completed OAuth handshake and marks the user connected.
     */
    public GarminConnection saveConnection(Long userId, String garminUserId, String accessToken,
                                           String refreshToken, long expiresInSeconds, String scopes) {
        Instant now = clock.instant();
        GarminConnection connection = connectionRepository.findById(userId).orElseGet(() -> {
            GarminConnection created = new GarminConnection();
            created.setUserId(userId);
            created.setCreatedAt(now);
            return created;
        });
        connection.setGarminUserId(garminUserId);
        connection.setAccessToken(encryptionUtil.encrypt(accessToken));
        connection.setRefreshToken(refreshToken == null ? null : encryptionUtil.encrypt(refreshToken));
        connection.setTokenExpiresAt(now.plusSeconds(expiresInSeconds));
        connection.setScopes(scopes);
        connection.setStatus(GarminConnection.ConnectionStatus.CONNECTED);
        connection.setConnectedAt(now);
        connection.setErrorState(null);
        connection.setUpdatedAt(now);
        logger.info("Garmin connected for user {} (garmin user {})", userId, garminUserId);
        return connectionRepository.save(connection);
    }

    /**
     * Decrypted access token, refreshed first when it expires within {@link #REFRESH_SKEW}.
     *
     * @throws GarminAuthException when the user is not connected or the token cannot be used
     */
    public String getValidAccessToken(Long userId) {
        GarminConnection connection = requireLinked(userId);
        Instant expiresAt = connection.getTokenExpiresAt();
        if (expiresAt != null && !expiresAt.isAfter(clock.instant().plus(REFRESH_SKEW))) {
            connection = refresh(userId);
        }
        return encryptionUtil.decrypt(connection.getAccessToken());
    }

    /**
     * Exchanges the stored refresh token for a new access token.
     *
     * @throws GarminAuthException when Garmin rejects the refresh token; the connection's error
     *                             state is recorded before the exception propagates
     */
    public GarminConnection refresh(Long userId) {
        GarminConnection connection = requireLinked(userId);
        GarminOAuthClient.TokenResponse tokens;
        try {
            if (connection.getRefreshToken() == null) {
                throw new GarminAuthException("No Garmin refresh token stored");
            }
            tokens = oauthClient.refresh(encryptionUtil.decrypt(connection.getRefreshToken()));
        } catch (GarminAuthException e) {
            markAuthError(userId, e.getMessage());
            throw e;
        }

        Instant now = clock.instant();
        connection.setAccessToken(encryptionUtil.encrypt(tokens.accessToken()));
        connection.setRefreshToken(encryptionUtil.encrypt(tokens.refreshToken()));
        connection.setTokenExpiresAt(now.plusSeconds(tokens.expiresInSeconds()));
        if (tokens.scope() != null) {
            connection.setScopes(tokens.scope());
        }
        connection.setStatus(GarminConnection.ConnectionStatus.CONNECTED);
        connection.setErrorState(null);
        connection.setUpdatedAt(now);
        logger.info("Refreshed Garmin token for user {}", userId);
        return connectionRepository.save(connection);
    }

    /**
     * Records an auth failure on the connection. Never throws.
     */
    public Outcome<Void> markAuthError(Long userId, String message) {
        Outcome<Void> outcome = Outcome.run(() -> connectionRepository.findById(userId).ifPresent(connection -> {
            connection.setStatus(GarminConnection.ConnectionStatus.ERROR);
            connection.setErrorState(errorState("auth_error", message));
            connection.setUpdatedAt(clock.instant());
            connectionRepository.save(connection);
        }));
        if (!outcome.isSuccess()) {
            logger.warn("Could not record Garmin auth error for user {}: {}", userId, outcome.errorMessage());
        }
        return outcome;
    }

    /**
     * Records a non-auth sync failure without changing the connection status. Never throws.
     */
    public Outcome<Void> markSyncError(Long userId, String reason, String message) {
        Outcome<Void> outcome = Outcome.run(() -> connectionRepository.findById(userId).ifPresent(connection -> {
            connection.setErrorState(errorState(reason, message));
            connection.setUpdatedAt(clock.instant());
            connectionRepository.save(connection);
        }));
        if (!outcome.isSuccess()) {
            logger.warn("Could not record Garmin sync error for user {}: {}", userId, outcome.errorMessage());
        }
        return outcome;
    }

    /**
     * Advances {@code lastSyncAt} and the cursor after a successful sync and clears the error
     * state. The cursor never moves backwards.
     */
    public GarminConnection markSyncSuccess(Long userId, Instant syncedAt) {
        GarminConnection connection = connectionRepository.findById(userId)
                .orElseThrow(() -> new GarminAuthException("Garmin is not connected"));
        connection.setLastSyncAt(syncedAt);
        Instant cursor = connection.getLastSyncCursor();
        if (cursor == null || syncedAt.isAfter(cursor)) {
            connection.setLastSyncCursor(syncedAt);
        }
        connection.setStatus(GarminConnection.ConnectionStatus.CONNECTED);
        connection.setErrorState(null);
        connection.setUpdatedAt(clock.instant());
        return connectionRepository.save(connection);
    }

    public void disconnect(Long userId) {
        connectionRepository.findById(userId).ifPresent(connection -> {
            connection.setStatus(GarminConnection.ConnectionStatus.DISCONNECTED);
            connection.setAccessToken(null);
            connection.setRefreshToken(null);
            connection.setTokenExpiresAt(null);
            connection.setUpdatedAt(clock.instant());
            connectionRepository.save(connection);
            logger.info("Garmin disconnected for user {}", userId);
        });
    }

    public List<Long> findUserIdsByGarminUserId(String garminUserId) {
        return connectionRepository.findByGarminUserId(garminUserId).stream()
                .filter(c -> c.getStatus() != GarminConnection.ConnectionStatus.DISCONNECTED)
                .map(GarminConnection::getUserId)
                .distinct()
                .toList();
    }

    public List<Long> listConnectedUserIds() {
        return connectionRepository.findByStatus(GarminConnection.ConnectionStatus.CONNECTED).stream()
                .map(GarminConnection::getUserId)
                .toList();
    }

    private GarminConnection requireLinked(Long userId) {
        GarminConnection connection = connectionRepository.findById(userId)
                .orElseThrow(() -> new GarminAuthException("Garmin is not connected"));
        if (connection.getStatus() == GarminConnection.ConnectionStatus.DISCONNECTED
                || connection.getAccessToken() == null) {
            throw new GarminAuthException("Garmin is not connected");
        }
        return connection;
    }

    private Map<String, Object> errorState(String reason, String message) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("reason", reason);
        state.put("message", message);
        state.put("recordedAt", clock.instant().toString());
        return state;
    }
}
