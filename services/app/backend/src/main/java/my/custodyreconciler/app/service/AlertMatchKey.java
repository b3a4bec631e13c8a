package my.custodyreconciler.app.service;

/**
 * Identifies "the same alert" across runs together with its event type.
 */
public record AlertMatchKey(Long bankAccountId, String portfolioCode) {
}
