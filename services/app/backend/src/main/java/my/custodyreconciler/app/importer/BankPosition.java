package my.custodyreconciler.app.importer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One line of a custodian position file after the custodian grammar has been parsed away.
 * Monetary values arrive already priced in {@code currency}.
 */
public record BankPosition(
		String bankId,
		String portfolioCode,
		String accountNumber,
		String isin,
		String positionNumber,
		String instrumentCode,
		String securityName,
		String assetClass,
		String securityType,
		String currency,
		BigDecimal quantity,
		BigDecimal marketPrice,
		BigDecimal marketValue,
		BigDecimal costPrice,
		LocalDate snapshotDate,
		Map<String, Object> bankSpecificData
) {
	public BankPosition {
		bankSpecificData = bankSpecificData == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(bankSpecificData));
	}

	public Optional<String> validationProblem() {
		if (portfolioCode == null || portfolioCode.isBlank()) {
			return Optional.of("portfolioCode is required");
		}
		if (currency == null || currency.isBlank()) {
			return Optional.of("currency is required");
		}
		if (marketValue == null) {
			return Optional.of("marketValue is required");
		}
		return Optional.empty();
	}

	public BankPosition withSnapshotDate(LocalDate date) {
		return new BankPosition(bankId, portfolioCode, accountNumber, isin, positionNumber, instrumentCode,
				securityName, assetClass, securityType, currency, quantity, marketPrice, marketValue, costPrice,
				date, bankSpecificData);
	}

	public BankPosition withEnrichment(String enrichedName, String enrichedAssetClass, Map<String, Object> extraData) {
		Map<String, Object> merged = new LinkedHashMap<>(bankSpecificData);
		if (extraData != null) {
			merged.putAll(extraData);
		}
		return new BankPosition(bankId, portfolioCode, accountNumber, isin, positionNumber, instrumentCode,
				enrichedName, enrichedAssetClass, securityType, currency, quantity, marketPrice, marketValue,
				costPrice, snapshotDate, merged);
	}
}
