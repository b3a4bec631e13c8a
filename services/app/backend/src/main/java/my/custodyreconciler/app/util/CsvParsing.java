package my.custodyreconciler.app.util;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CsvParsing {
	private static final Pattern DATE_IN_FILENAME = Pattern.compile("(\\d{8})");

	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int lineEnd = sample.indexOf('\n');
		String header = lineEnd < 0 ? sample : sample.substring(0, lineEnd);
		if (header.indexOf(';') >= 0) {
			return ';';
		}
		if (header.indexOf('\t') >= 0 && header.indexOf(',') < 0) {
			return '\t';
		}
		return ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	public static String blankToNull(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}

	/**
	 * Parses a decimal written either as {@code 1,234.56} or {@code 1.234,56}.
	 * Returns null for blank input.
	 *
	 * @throws NumberFormatException when the value is not a number in either notation
	 */
	public static BigDecimal parseDecimal(String raw) {
		String value = blankToNull(raw);
		if (value == null) {
			return null;
		}
		value = value.replace(" ", "").replace("'", "");
		int lastComma = value.lastIndexOf(',');
		int lastDot = value.lastIndexOf('.');
		if (lastComma >= 0 && lastDot >= 0) {
			if (lastComma > lastDot) {
				value = value.replace(".", "").replace(",", ".");
			} else {
				value = value.replace(",", "");
			}
		} else if (lastComma >= 0) {
			value = value.replace(",", ".");
		}
		return new BigDecimal(value);
	}

	/**
	 * Accepts ISO dates and {@code yyyyMMdd}. Returns null for blank input.
	 */
	public static LocalDate parseDate(String raw) {
		String value = blankToNull(raw);
		if (value == null) {
			return null;
		}
		if (value.length() == 8 && value.chars().allMatch(Character::isDigit)) {
			return dateFromDigits(value);
		}
		try {
			return LocalDate.parse(value);
		} catch (DateTimeParseException exc) {
			throw new IllegalArgumentException("Unsupported date: " + value, exc);
		}
	}

	/**
	 * Returns the last {@code yyyyMMdd} group in the filename, or null when there is none.
	 */
	public static LocalDate dateFromFilename(String filename) {
		Matcher matcher = DATE_IN_FILENAME.matcher(filename == null ? "" : filename);
		LocalDate found = null;
		while (matcher.find()) {
			try {
				found = dateFromDigits(matcher.group(1));
			} catch (IllegalArgumentException ignored) {
				// eight digits that are not a date, keep scanning
			}
		}
		return found;
	}

	public static String normalizeHeader(String header) {
		String value = stripBom(header);
		return value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
	}

	private static LocalDate dateFromDigits(String yyyymmdd) {
		try {
			int year = Integer.parseInt(yyyymmdd.substring(0, 4));
			int month = Integer.parseInt(yyyymmdd.substring(4, 6));
			int day = Integer.parseInt(yyyymmdd.substring(6, 8));
			return LocalDate.of(year, month, day);
		} catch (RuntimeException exc) {
			throw new IllegalArgumentException("Unsupported date: " + yyyymmdd, exc);
		}
	}
}
