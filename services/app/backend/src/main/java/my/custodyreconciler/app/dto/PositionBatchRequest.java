package my.custodyreconciler.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Positions are checked one by one during the import; only the batch envelope is validated here.
 */
public record PositionBatchRequest(@NotBlank String bankId,
								   @NotNull LocalDate fileDate,
								   String sourceFile,
								   @NotEmpty List<@Valid @NotNull PositionRequest> positions) {
	public record PositionRequest(String portfolioCode,
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
								  Map<String, Object> bankSpecificData) {
	}
}
