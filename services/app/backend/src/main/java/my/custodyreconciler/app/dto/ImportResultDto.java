package my.custodyreconciler.app.dto;

import java.time.LocalDate;
import java.util.List;

public record ImportResultDto(Long runId,
							  String bankId,
							  LocalDate fileDate,
							  String sourceFile,
							  String status,
							  int totalRecords,
							  int created,
							  int updated,
							  int unchanged,
							  int skipped,
							  int sold,
							  int allocationsRedeemed,
							  int snapshots,
							  List<String> unmappedCodes,
							  List<ImportErrorDto> errors) {
}
