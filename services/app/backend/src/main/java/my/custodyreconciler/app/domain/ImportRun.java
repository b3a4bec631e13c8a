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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "import_runs")
public class ImportRun {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "run_id")
	private Long runId;

	@Column(name = "bank_id", nullable = false)
	private String bankId;

	@Column(name = "source_file")
	private String sourceFile;

	@Column(name = "file_date", nullable = false)
	private LocalDate fileDate;

	@Column(name = "triggered_by", nullable = false)
	private String triggeredBy;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private ImportRunStatus status;

	@Column(name = "total_records", nullable = false)
	private int totalRecords;

	@Column(name = "created_count", nullable = false)
	private int createdCount;

	@Column(name = "updated_count", nullable = false)
	private int updatedCount;

	@Column(name = "unchanged_count", nullable = false)
	private int unchangedCount;

	@Column(name = "skipped_count", nullable = false)
	private int skippedCount;

	@Column(name = "sold_count", nullable = false)
	private int soldCount;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "unmapped_codes", nullable = false)
	private List<String> unmappedCodes = new ArrayList<>();

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "errors", nullable = false)
	private List<Map<String, String>> errors = new ArrayList<>();

	@Column(name = "started_at", nullable = false)
	private LocalDateTime startedAt;

	@Column(name = "finished_at")
	private LocalDateTime finishedAt;

	@Column(name = "failure_message")
	private String failureMessage;

	public Long getRunId() {
		return runId;
	}

	public void setRunId(Long runId) {
		this.runId = runId;
	}

	public String getBankId() {
		return bankId;
	}

	public void setBankId(String bankId) {
		this.bankId = bankId;
	}

	public String getSourceFile() {
		return sourceFile;
	}

	public void setSourceFile(String sourceFile) {
		this.sourceFile = sourceFile;
	}

	public LocalDate getFileDate() {
		return fileDate;
	}

	public void setFileDate(LocalDate fileDate) {
		this.fileDate = fileDate;
	}

	public String getTriggeredBy() {
		return triggeredBy;
	}

	public void setTriggeredBy(String triggeredBy) {
		this.triggeredBy = triggeredBy;
	}

	public ImportRunStatus getStatus() {
		return status;
	}

	public void setStatus(ImportRunStatus status) {
		this.status = status;
	}

	public int getTotalRecords() {
		return totalRecords;
	}

	public void setTotalRecords(int totalRecords) {
		this.totalRecords = totalRecords;
	}

	public int getCreatedCount() {
		return createdCount;
	}

	public void setCreatedCount(int createdCount) {
		this.createdCount = createdCount;
	}

	public int getUpdatedCount() {
		return updatedCount;
	}

	public void setUpdatedCount(int updatedCount) {
		this.updatedCount = updatedCount;
	}

	public int getUnchangedCount() {
		return unchangedCount;
	}

	public void setUnchangedCount(int unchangedCount) {
		this.unchangedCount = unchangedCount;
	}

	public int getSkippedCount() {
		return skippedCount;
	}

	public void setSkippedCount(int skippedCount) {
		this.skippedCount = skippedCount;
	}

	public int getSoldCount() {
		return soldCount;
	}

	public void setSoldCount(int soldCount) {
		this.soldCount = soldCount;
	}

	public List<String> getUnmappedCodes() {
		return unmappedCodes;
	}

	public void setUnmappedCodes(List<String> unmappedCodes) {
		this.unmappedCodes = unmappedCodes;
	}

	public List<Map<String, String>> getErrors() {
		return errors;
	}

	public void setErrors(List<Map<String, String>> errors) {
		this.errors = errors;
	}

	public LocalDateTime getStartedAt() {
		return startedAt;
	}

	public void setStartedAt(LocalDateTime startedAt) {
		this.startedAt = startedAt;
	}

	public LocalDateTime getFinishedAt() {
		return finishedAt;
	}

	public void setFinishedAt(LocalDateTime finishedAt) {
		this.finishedAt = finishedAt;
	}

	public String getFailureMessage() {
		return failureMessage;
	}

	public void setFailureMessage(String failureMessage) {
		this.failureMessage = failureMessage;
	}
}
