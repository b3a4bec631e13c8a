package my.custodyreconciler.app.service.util;

import my.custodyreconciler.app.importer.BankPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable identity of a position across daily files: bank, portfolio and the best instrument identifier the
 * custodian supplied, hashed with SHA-256.
 */
public final class UniqueKeyUtil {
	private static final Logger logger = LoggerFactory.getLogger(UniqueKeyUtil.class);
	static final String UNIDENTIFIED = "UNIDENTIFIED";

	private UniqueKeyUtil() {
	}

	public static String key(BankPosition position) {
		return key(position.bankId(), position.portfolioCode(), position.isin(), position.positionNumber(),
				position.instrumentCode(), position.currency());
	}

	public static String key(String bankId, String portfolioCode, String isin, String positionNumber,
							 String instrumentCode, String currency) {
		return sha256(rawKey(bankId, portfolioCode, isin, positionNumber, instrumentCode, currency));
	}

	static String rawKey(String bankId, String portfolioCode, String isin, String positionNumber,
						 String instrumentCode, String currency) {
		String prefix = bankId + "|" + portfolioCode + "|";
		String normalizedIsin = ISINUtil.normalize(isin);
		if (normalizedIsin != null) {
			return prefix + normalizedIsin;
		}
		if (!isBlank(positionNumber)) {
			return prefix + positionNumber.trim();
		}
		if (!isBlank(instrumentCode)) {
			return prefix + instrumentCode.trim() + "|" + (currency == null ? "" : currency.trim());
		}
		// every unidentified line of the portfolio collapses onto one key
		logger.warn("Position in portfolio {} of bank {} has no ISIN, position number or instrument code",
				portfolioCode, bankId);
		return prefix + UNIDENTIFIED;
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	private static String sha256(String value) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException exc) {
			throw new IllegalStateException("SHA-256 not available", exc);
		}
	}
}
