package my.custodyreconciler.app.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record ImportRunDto(Long runId,
						   String bankId,
						   String sourceFile,
						   LocalDate fileDate,
						   String triggeredBy,
						   String status,
						   int totalRecords,
						   int created,
						   int updated,
						   int unchanged,
						   int skipped,
						   int sold,
						   List<String> unmappedCodes,
						   int errorCount,
						   LocalDateTime startedAt,
						   LocalDateTime finishedAt,
						   String failureMessage) {
}
