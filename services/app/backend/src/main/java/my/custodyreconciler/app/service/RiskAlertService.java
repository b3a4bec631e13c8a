package my.custodyreconciler.app.service;

import my.custodyreconciler.app.domain.AlertEventType;
import my.custodyreconciler.app.domain.RiskAlert;
import my.custodyreconciler.app.dto.AlertDto;
import my.custodyreconciler.app.repository.RiskAlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Stores risk alerts in {@code risk_alerts}, where operators pick them up through the alert API.
 */
@Service
public class RiskAlertService implements NotificationSink {
	private static final Logger logger = LoggerFactory.getLogger(RiskAlertService.class);
	private final RiskAlertRepository riskAlertRepository;

	public RiskAlertService(RiskAlertRepository riskAlertRepository) {
		this.riskAlertRepository = riskAlertRepository;
	}

	@Override
	public void createAlert(AlertRequest request) {
		RiskAlert alert = new RiskAlert();
		alert.setEventType(request.eventType());
		alert.setSeverity(request.eventType().severity());
		alert.setTitle(request.title());
		alert.setMessage(request.message());
		alert.setBankAccountId(request.matchKey().bankAccountId());
		alert.setPortfolioCode(request.matchKey().portfolioCode());
		alert.setBankId(request.bankId());
		alert.setRecipientIds(new ArrayList<>(request.recipientIds()));
		alert.setMetadata(new LinkedHashMap<>(request.metadata()));
		alert.setCreatedAt(LocalDateTime.now());
		alert.setCreatedBy(request.createdBy() == null ? "system" : request.createdBy());
		riskAlertRepository.save(alert);
		logger.info("Raised {} alert for account {} portfolio {} to {} recipients", request.eventType().code(),
				request.matchKey().bankAccountId(), request.matchKey().portfolioCode(), request.recipientIds().size());
	}

	@Override
	@Transactional
	public int resolveAlerts(AlertEventType eventType, AlertMatchKey matchKey) {
		int removed = riskAlertRepository.deleteByMatchKey(eventType, matchKey.bankAccountId(), matchKey.portfolioCode());
		if (removed > 0) {
			logger.info("Resolved {} {} alerts for account {} portfolio {}", removed, eventType.code(),
					matchKey.bankAccountId(), matchKey.portfolioCode());
		}
		return removed;
	}

	@Override
	public boolean hasRecentAlert(AlertEventType eventType, AlertMatchKey matchKey, Duration window) {
		if (window == null || window.isZero() || window.isNegative()) {
			return false;
		}
		LocalDateTime since = LocalDateTime.now().minus(window);
		return riskAlertRepository.existsByEventTypeAndBankAccountIdAndPortfolioCodeAndCreatedAtAfter(
				eventType, matchKey.bankAccountId(), matchKey.portfolioCode(), since);
	}

	public List<AlertDto> listAlerts(String eventType, Long bankAccountId) {
		AlertEventType type = eventType == null || eventType.isBlank() ? null : AlertEventType.fromCode(eventType);
		List<RiskAlert> alerts;
		if (type != null && bankAccountId != null) {
			alerts = riskAlertRepository.findByEventTypeAndBankAccountIdOrderByCreatedAtDesc(type, bankAccountId);
		} else if (type != null) {
			alerts = riskAlertRepository.findByEventTypeOrderByCreatedAtDesc(type);
		} else if (bankAccountId != null) {
			alerts = riskAlertRepository.findByBankAccountIdOrderByCreatedAtDesc(bankAccountId);
		} else {
			alerts = riskAlertRepository.findAllByOrderByCreatedAtDesc();
		}
		return alerts.stream().map(this::toDto).toList();
	}

	private AlertDto toDto(RiskAlert alert) {
		return new AlertDto(
				alert.getAlertId(),
				alert.getEventType().code(),
				alert.getSeverity(),
				alert.getTitle(),
				alert.getMessage(),
				alert.getBankAccountId(),
				alert.getPortfolioCode(),
				alert.getBankId(),
				alert.getRecipientIds(),
				alert.getMetadata(),
				alert.getCreatedAt(),
				alert.getCreatedBy()
		);
	}
}
