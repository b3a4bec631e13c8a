package my.custodyreconciler.app.service;

import my.custodyreconciler.app.domain.Holding;
import my.custodyreconciler.app.domain.PortfolioSnapshot;
import my.custodyreconciler.app.dto.SnapshotDto;
import my.custodyreconciler.app.repository.PortfolioSnapshotRepository;
import my.custodyreconciler.app.service.util.AssetClassResolver;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

@Service
public class PortfolioSnapshotService {
	private final PortfolioSnapshotRepository snapshotRepository;

	public PortfolioSnapshotService(PortfolioSnapshotRepository snapshotRepository) {
		this.snapshotRepository = snapshotRepository;
	}

	/**
	 * Builds the point-in-time view of one portfolio and stores it, replacing an earlier snapshot of the same
	 * owner, portfolio and date.
	 */
	public PortfolioSnapshot snapshot(Long ownerId, String bankId, String portfolioCode, List<Holding> holdings,
									  LocalDate snapshotDate) {
		BigDecimal cashBalance = BigDecimal.ZERO;
		BigDecimal totalMarketValue = BigDecimal.ZERO;
		Map<String, BigDecimal> investments = new LinkedHashMap<>();
		Map<String, Integer> currencyCounts = new TreeMap<>();
		for (Holding holding : holdings) {
			BigDecimal value = holding.getMarketValue() == null ? BigDecimal.ZERO : holding.getMarketValue();
			if (holding.getCurrency() != null) {
				currencyCounts.merge(holding.getCurrency(), 1, Integer::sum);
			}
			if (AssetClassResolver.isCash(holding)) {
				cashBalance = cashBalance.add(value);
			} else {
				totalMarketValue = totalMarketValue.add(value);
				investments.merge(AssetClassResolver.categoryKey(holding), value, BigDecimal::add);
			}
		}
		Map<String, BigDecimal> breakdown = new LinkedHashMap<>();
		if (cashBalance.signum() > 0) {
			breakdown.put(AssetClassResolver.CASH, cashBalance);
		}
		investments.forEach((key, value) -> breakdown.merge(key, value, BigDecimal::add));

		PortfolioSnapshot snapshot = snapshotRepository
				.findByOwnerIdAndPortfolioCodeAndSnapshotDate(ownerId, portfolioCode, snapshotDate)
				.orElseGet(PortfolioSnapshot::new);
		LocalDateTime now = LocalDateTime.now();
		if (snapshot.getSnapshotId() == null) {
			snapshot.setCreatedAt(now);
		}
		Holding reference = holdings.isEmpty() ? null : holdings.get(0);
		snapshot.setOwnerId(ownerId);
		snapshot.setBankId(bankId);
		snapshot.setPortfolioCode(portfolioCode);
		snapshot.setAccountNumber(reference == null ? snapshot.getAccountNumber() : reference.getAccountNumber());
		snapshot.setSnapshotDate(snapshotDate);
		snapshot.setFileDate(latestFileDate(holdings, snapshot.getFileDate()));
		snapshot.setSourceFile(reference == null ? snapshot.getSourceFile() : reference.getSourceFile());
		snapshot.setCashBalance(cashBalance);
		snapshot.setTotalMarketValue(totalMarketValue);
		snapshot.setTotalAccountValue(totalMarketValue.add(cashBalance));
		snapshot.setPositionCount(holdings.size());
		snapshot.setCurrency(dominantCurrency(currencyCounts));
		snapshot.setHasMixedCurrencies(currencyCounts.size() > 1);
		snapshot.setAssetClassBreakdown(breakdown);
		snapshot.setUpdatedAt(now);
		return snapshotRepository.save(snapshot);
	}

	public List<SnapshotDto> findSnapshots(Long ownerId, String portfolioCode, LocalDate from, LocalDate to) {
		if (ownerId == null) {
			throw new IllegalArgumentException("ownerId is required");
		}
		LocalDate end = to == null ? LocalDate.now() : to;
		LocalDate start = from == null ? end.minusYears(1) : from;
		if (start.isAfter(end)) {
			throw new IllegalArgumentException("from must not be after to");
		}
		List<PortfolioSnapshot> snapshots = portfolioCode == null || portfolioCode.isBlank()
				? snapshotRepository.findByOwnerIdAndSnapshotDateBetweenOrderBySnapshotDateDesc(ownerId, start, end)
				: snapshotRepository.findByOwnerIdAndPortfolioCodeAndSnapshotDateBetweenOrderBySnapshotDateDesc(
						ownerId, portfolioCode, start, end);
		List<SnapshotDto> result = new ArrayList<>();
		for (PortfolioSnapshot snapshot : snapshots) {
			result.add(toDto(snapshot));
		}
		return result;
	}

	private String dominantCurrency(Map<String, Integer> currencyCounts) {
		// on equal counts the alphabetically first currency wins
		return currencyCounts.entrySet().stream()
				.max(Comparator.comparingInt(Map.Entry<String, Integer>::getValue)
						.thenComparing(entry -> entry.getKey(), Comparator.reverseOrder()))
				.map(Map.Entry::getKey)
				.orElse(null);
	}

	private LocalDate latestFileDate(List<Holding> holdings, LocalDate fallback) {
		return holdings.stream()
				.map(Holding::getFileDate)
				.filter(Objects::nonNull)
				.max(LocalDate::compareTo)
				.orElse(fallback);
	}

	private SnapshotDto toDto(PortfolioSnapshot snapshot) {
		return new SnapshotDto(
				snapshot.getSnapshotId(),
				snapshot.getOwnerId(),
				snapshot.getBankId(),
				snapshot.getPortfolioCode(),
				snapshot.getAccountNumber(),
				snapshot.getSnapshotDate(),
				snapshot.getFileDate(),
				snapshot.getTotalMarketValue(),
				snapshot.getCashBalance(),
				snapshot.getTotalAccountValue(),
				snapshot.getPositionCount(),
				snapshot.getCurrency(),
				snapshot.isHasMixedCurrencies(),
				snapshot.getAssetClassBreakdown()
		);
	}
}
