package my.custodyreconciler.app.service;

import my.custodyreconciler.app.domain.Holding;
import my.custodyreconciler.app.dto.ImportErrorDto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What one reconciliation pass saw: processed keys, touched portfolios and holdings, and the counters.
 * Created by {@link PositionReconciler} and handed to the later stages of the same account group. Not
 * shared between threads.
 */
public final class BatchContext {
	private final String bankId;
	private final LocalDate fileDate;
	private final String sourceFile;
	private final Set<String> processedKeys = new HashSet<>();
	private final Map<String, Portfolio> portfolios = new LinkedHashMap<>();
	private final Map<String, Holding> touchedHoldings = new LinkedHashMap<>();
	private final Set<String> unmappedCodes = new LinkedHashSet<>();
	private final List<ImportErrorDto> errors = new ArrayList<>();
	private int created;
	private int updated;
	private int unchanged;
	private int skipped;
	private int sold;

	public BatchContext(String bankId, LocalDate fileDate, String sourceFile) {
		this.bankId = bankId;
		this.fileDate = fileDate;
		this.sourceFile = sourceFile;
	}

	public record Portfolio(String bankId, String portfolioCode, Long ownerId, Long bankAccountId) {
	}

	void recordCreated(Holding holding) {
		created++;
		recordProcessed(holding);
	}

	void recordUpdated(Holding holding) {
		updated++;
		recordProcessed(holding);
	}

	void recordUnchanged(Holding holding) {
		unchanged++;
		recordProcessed(holding);
	}

	void recordUnmapped(String portfolioCode) {
		skipped++;
		if (portfolioCode != null) {
			unmappedCodes.add(portfolioCode);
		}
	}

	public void recordError(String portfolioCode, String isin, String error) {
		skipped++;
		errors.add(new ImportErrorDto(portfolioCode, isin, error));
	}

	/**
	 * Problems that are not tied to a single position, so no skip is counted.
	 */
	public void recordIssue(String portfolioCode, String isin, String error) {
		errors.add(new ImportErrorDto(portfolioCode, isin, error));
	}

	void addSold(int count) {
		sold += count;
	}

	private void recordProcessed(Holding holding) {
		processedKeys.add(holding.getUniqueKey());
		touchedHoldings.put(holding.getUniqueKey(), holding);
		portfolios.putIfAbsent(holding.getPortfolioCode(), new Portfolio(holding.getBankId(),
				holding.getPortfolioCode(), holding.getOwnerId(), holding.getBankAccountId()));
	}

	public boolean isProcessed(String uniqueKey) {
		return processedKeys.contains(uniqueKey);
	}

	public String bankId() {
		return bankId;
	}

	public LocalDate fileDate() {
		return fileDate;
	}

	public String sourceFile() {
		return sourceFile;
	}

	public Collection<Portfolio> portfolios() {
		return List.copyOf(portfolios.values());
	}

	public List<Holding> touchedHoldings() {
		return List.copyOf(touchedHoldings.values());
	}

	public List<String> unmappedCodes() {
		return List.copyOf(unmappedCodes);
	}

	public List<ImportErrorDto> errors() {
		return List.copyOf(errors);
	}

	public int created() {
		return created;
	}

	public int updated() {
		return updated;
	}

	public int unchanged() {
		return unchanged;
	}

	public int skipped() {
		return skipped;
	}

	public int sold() {
		return sold;
	}
}
