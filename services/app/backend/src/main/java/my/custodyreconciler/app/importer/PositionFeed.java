package my.custodyreconciler.app.importer;

public interface PositionFeed {
	/**
	 * Returns the newest parsed batch available for the bank.
	 *
	 * @throws FeedUnavailableException when the bank has no feed directory or no file
	 */
	PositionBatch readLatest(String bankId);
}
