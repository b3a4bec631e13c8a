package my.custodyreconciler.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "risk_alerts")
public class RiskAlert {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "alert_id")
	private Long alertId;

	@Enumerated(EnumType.STRING)
	@Column(name = "event_type", nullable = false)
	private AlertEventType eventType;

	@Column(name = "severity", nullable = false)
	private String severity;

	@Column(name = "title", nullable = false)
	private String title;

	@Column(name = "message", nullable = false)
	private String message;

	@Column(name = "bank_account_id")
	private Long bankAccountId;

	@Column(name = "portfolio_code")
	private String portfolioCode;

	@Column(name = "bank_id")
	private String bankId;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "recipient_ids", nullable = false)
	private List<Long> recipientIds = new ArrayList<>();

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "metadata", nullable = false)
	private Map<String, Object> metadata = new LinkedHashMap<>();

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "created_by", nullable = false)
	private String createdBy;

	public Long getAlertId() {
		return alertId;
	}

	public void setAlertId(Long alertId) {
		this.alertId = alertId;
	}

	public AlertEventType getEventType() {
		return eventType;
	}

	public void setEventType(AlertEventType eventType) {
		this.eventType = eventType;
	}

	public String getSeverity() {
		return severity;
	}

	public void setSeverity(String severity) {
		this.severity = severity;
	}

	public String getTitle() {
		return title;
	}

	public void setTitle(String title) {
		this.title = title;
	}

	public String getMessage() {
		return message;
	}

	public void setMessage(String message) {
		this.message = message;
	}

	public Long getBankAccountId() {
		return bankAccountId;
	}

	public void setBankAccountId(Long bankAccountId) {
		this.bankAccountId = bankAccountId;
	}

	public String getPortfolioCode() {
		return portfolioCode;
	}

	public void setPortfolioCode(String portfolioCode) {
		this.portfolioCode = portfolioCode;
	}

	public String getBankId() {
		return bankId;
	}

	public void setBankId(String bankId) {
		this.bankId = bankId;
	}

	public List<Long> getRecipientIds() {
		return recipientIds;
	}

	public void setRecipientIds(List<Long> recipientIds) {
		this.recipientIds = recipientIds;
	}

	public Map<String, Object> getMetadata() {
		return metadata;
	}

	public void setMetadata(Map<String, Object> metadata) {
		this.metadata = metadata;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public String getCreatedBy() {
		return createdBy;
	}

	public void setCreatedBy(String createdBy) {
		this.createdBy = createdBy;
	}
}
