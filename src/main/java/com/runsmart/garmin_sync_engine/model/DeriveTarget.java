package com.runsmart.garmin_sync_engine.model;

/**
 * Who a derive job is for: an app user directly, or a Garmin user that still has to be
 * resolved to one or more app users.
 */
public sealed interface DeriveTarget permits DeriveTarget.ByUserId, DeriveTarget.ByGarminUserId {

    record ByUserId(Long userId) implements DeriveTarget {
    }

    record ByGarminUserId(String garminUserId) implements DeriveTarget {
    }
}
