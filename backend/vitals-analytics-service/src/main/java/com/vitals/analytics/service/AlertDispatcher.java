package com.vitals.analytics.service;

import com.vitals.analytics.model.AnomalyEvent;

/**
 * Best-effort notification of a persisted anomaly.
 *
 * <p>At-most-once, no retry: implementations must not throw, and a failed dispatch is
 * lost for that anomaly. The anomaly row itself is never affected. Stronger delivery
 * belongs in a separate outbox component, not here.
 */
public interface AlertDispatcher {

  void dispatch(AnomalyEvent anomaly);
}
