package com.processsentinel.core.alert;

import com.processsentinel.core.model.Alert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for alerts.
 *
 * <p>
 * Implementations must not hand out references they keep internally; the
 * engine mutates the alerts it receives. Failures are reported as
 * {@link AlertStoreException}.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertStore {

    void insert(Alert alert);

    /** Replace the stored alert with the same id. */
    void update(Alert alert);

    Optional<Alert> findById(String id);

    /**
     * @param limit                maximum number of alerts
     * @param unacknowledgedOnly   skip acknowledged alerts
     * @return alerts newest first
     */
    List<Alert> findRecent(int limit, boolean unacknowledgedOnly);

    /** @return alerts created at or after {@code since} */
    List<Alert> findCreatedSince(Instant since);

    /**
     * @param cutoff exclusive upper bound on creation time
     * @return number of resolved alerts deleted
     */
    int deleteResolvedCreatedBefore(Instant cutoff);
}
