package my.custodyreconciler.app.importer;

import my.custodyreconciler.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses the normalized position layout that custodian-specific converters write into the feed folder.
 * Columns outside the normalized set are kept as bank specific data.
 */
@Component
public class NormalizedCsvPositionParser implements PositionFileParser {
	private static final Logger logger = LoggerFactory.getLogger(NormalizedCsvPositionParser.class);

	static final String PORTFOLIO_CODE = "portfolio_code";
	static final String ACCOUNT_NUMBER = "account_number";
	static final String ISIN = "isin";
	static final String POSITION_NUMBER = "position_number";
	static final String INSTRUMENT_CODE = "instrument_code";
	static final String SECURITY_NAME = "security_name";
	static final String ASSET_CLASS = "asset_class";
	static final String SECURITY_TYPE = "security_type";
	static final String CURRENCY = "currency";
	static final String QUANTITY = "quantity";
	static final String MARKET_PRICE = "market_price";
	static final String MARKET_VALUE = "market_value";
	static final String COST_PRICE = "cost_price";
	static final String SNAPSHOT_DATE = "snapshot_date";

	private static final Set<String> KNOWN_COLUMNS = Set.of(PORTFOLIO_CODE, ACCOUNT_NUMBER, ISIN, POSITION_NUMBER,
			INSTRUMENT_CODE, SECURITY_NAME, ASSET_CLASS, SECURITY_TYPE, CURRENCY, QUANTITY, MARKET_PRICE,
			MARKET_VALUE, COST_PRICE, SNAPSHOT_DATE);

	@Override
	public PositionBatch parse(byte[] payload, String filename, String bankId, LocalDate fileDate) {
		String content = CsvParsing.decodeUtf8(payload);
		char delimiter = CsvParsing.sniffDelimiter(content);
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(delimiter)
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreEmptyLines(true)
				.setTrim(true)
				.build();

		List<BankPosition> positions = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
			Map<String, String> headers = normalizedHeaders(parser.getHeaderNames());
			if (!headers.containsKey(PORTFOLIO_CODE)) {
				throw new IllegalArgumentException("Position file " + filename + " has no " + PORTFOLIO_CODE + " column");
			}
			for (CSVRecord record : parser) {
				positions.add(toPosition(record, headers, bankId, fileDate, filename));
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read position file " + filename + ": " + exc.getMessage(), exc);
		}
		logger.info("Parsed {} positions from {} for bank {}", positions.size(), filename, bankId);
		return new PositionBatch(bankId, fileDate, filename, positions);
	}

	private BankPosition toPosition(CSVRecord record, Map<String, String> headers, String bankId,
									LocalDate fileDate, String filename) {
		Map<String, Object> extra = new LinkedHashMap<>();
		for (Map.Entry<String, String> header : headers.entrySet()) {
			if (!KNOWN_COLUMNS.contains(header.getKey()) && record.isSet(header.getValue())) {
				String value = CsvParsing.blankToNull(record.get(header.getValue()));
				if (value != null) {
					extra.put(header.getKey(), value);
				}
			}
		}
		String isin = text(record, headers, ISIN);
		LocalDate snapshotDate = date(record, headers, filename);
		return new BankPosition(
				bankId,
				text(record, headers, PORTFOLIO_CODE),
				text(record, headers, ACCOUNT_NUMBER),
				isin == null ? null : isin.toUpperCase(Locale.ROOT),
				text(record, headers, POSITION_NUMBER),
				text(record, headers, INSTRUMENT_CODE),
				text(record, headers, SECURITY_NAME),
				text(record, headers, ASSET_CLASS),
				text(record, headers, SECURITY_TYPE),
				upper(text(record, headers, CURRENCY)),
				decimal(record, headers, QUANTITY, filename),
				decimal(record, headers, MARKET_PRICE, filename),
				decimal(record, headers, MARKET_VALUE, filename),
				decimal(record, headers, COST_PRICE, filename),
				snapshotDate == null ? fileDate : snapshotDate,
				extra
		);
	}

	private Map<String, String> normalizedHeaders(List<String> rawHeaders) {
		Map<String, String> headers = new LinkedHashMap<>();
		for (String raw : rawHeaders) {
			headers.putIfAbsent(CsvParsing.normalizeHeader(raw), raw);
		}
		return headers;
	}

	private String text(CSVRecord record, Map<String, String> headers, String column) {
		String raw = headers.get(column);
		if (raw == null || !record.isSet(raw)) {
			return null;
		}
		return CsvParsing.blankToNull(record.get(raw));
	}

	private BigDecimal decimal(CSVRecord record, Map<String, String> headers, String column, String filename) {
		String value = text(record, headers, column);
		try {
			return CsvParsing.parseDecimal(value);
		} catch (NumberFormatException exc) {
			logger.warn("Ignoring unparsable {} '{}' in {} line {}", column, value, filename,
					record.getRecordNumber());
			return null;
		}
	}

	private LocalDate date(CSVRecord record, Map<String, String> headers, String filename) {
		String value = text(record, headers, SNAPSHOT_DATE);
		try {
			return CsvParsing.parseDate(value);
		} catch (IllegalArgumentException exc) {
			logger.warn("Falling back to file date for snapshot date '{}' in {} line {}", value, filename,
					record.getRecordNumber());
			return null;
		}
	}

	private String upper(String value) {
		return value == null ? null : value.toUpperCase(Locale.ROOT);
	}
}
