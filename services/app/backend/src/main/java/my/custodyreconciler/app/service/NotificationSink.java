package my.custodyreconciler.app.service;

import my.custodyreconciler.app.domain.AlertEventType;

import java.time.Duration;

/**
 * Receives risk events. Deciding how recipients are actually notified is left to the implementation.
 */
public interface NotificationSink {
	void createAlert(AlertRequest request);

	/**
	 * @return number of alerts removed
	 */
	int resolveAlerts(AlertEventType eventType, AlertMatchKey matchKey);

	/**
	 * A zero or negative window never reports a recent alert.
	 */
	boolean hasRecentAlert(AlertEventType eventType, AlertMatchKey matchKey, Duration window);
}
