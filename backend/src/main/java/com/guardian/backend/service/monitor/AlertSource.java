package com.guardian.backend.service.monitor;

/**
 * Long-lived producer of portfolio snapshots and alerts for one account.
 */
public interface AlertSource {

    /**
     * Latest snapshot, or {@code null} before the first evaluation.
     */
    PortfolioSnapshot getCurrentSnapshot();

    /**
     * Registers a listener invoked once for every newly detected condition.
     */
    void subscribe(AlertListener listener);
}
