package my.custodyreconciler.app.service.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class ISINUtil {
	private static final Pattern ISIN_RE = Pattern.compile("^[A-Z]{2}[A-Z0-9]{9}[0-9]$");

	private ISINUtil() {
	}

	/**
	 * Upper-cases and trims; blank input yields null. Custodians send internal codes in the ISIN column
	 * often enough that the format is not enforced here.
	 */
	public static String normalize(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim().toUpperCase(Locale.ROOT);
		return trimmed.isEmpty() ? null : trimmed;
	}

	public static boolean isValid(String value) {
		String normalized = normalize(value);
		return normalized != null && ISIN_RE.matcher(normalized).matches();
	}
}
