package my.custodyreconciler.app.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record AlertDto(Long alertId,
					   String eventType,
					   String severity,
					   String title,
					   String message,
					   Long bankAccountId,
					   String portfolioCode,
					   String bankId,
					   List<Long> recipientIds,
					   Map<String, Object> metadata,
					   LocalDateTime createdAt,
					   String createdBy) {
}
