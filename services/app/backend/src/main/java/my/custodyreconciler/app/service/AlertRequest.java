package my.custodyreconciler.app.service;

import my.custodyreconciler.app.domain.AlertEventType;

import java.util.List;
import java.util.Map;

public record AlertRequest(
		AlertEventType eventType,
		AlertMatchKey matchKey,
		String bankId,
		List<Long> recipientIds,
		String title,
		String message,
		Map<String, Object> metadata,
		String createdBy
) {
	public AlertRequest {
		recipientIds = recipientIds == null ? List.of() : List.copyOf(recipientIds);
		metadata = metadata == null ? Map.of() : metadata;
	}
}
