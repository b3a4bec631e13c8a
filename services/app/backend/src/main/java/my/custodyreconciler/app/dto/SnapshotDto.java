package my.custodyreconciler.app.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

public record SnapshotDto(Long snapshotId,
						  Long ownerId,
						  String bankId,
						  String portfolioCode,
						  String accountNumber,
						  LocalDate snapshotDate,
						  LocalDate fileDate,
						  BigDecimal totalMarketValue,
						  BigDecimal cashBalance,
						  BigDecimal totalAccountValue,
						  int positionCount,
						  String currency,
						  boolean hasMixedCurrencies,
						  Map<String, BigDecimal> assetClassBreakdown) {
}
