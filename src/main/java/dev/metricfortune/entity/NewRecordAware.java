package dev.metricfortune.entity;

/**
 * Entities with application-assigned Snowflake ids carry a transient {@code newRecord}
 * flag so that {@code save()} can tell INSERT from UPDATE.
 * {@link dev.metricfortune.config.PersistableEntityCallback} clears it on load.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
