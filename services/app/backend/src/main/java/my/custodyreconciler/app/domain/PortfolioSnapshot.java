package my.custodyreconciler.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "portfolio_snapshots")
public class PortfolioSnapshot {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "snapshot_id")
	private Long snapshotId;

	@Column(name = "owner_id", nullable = false)
	private Long ownerId;

	@Column(name = "bank_id", nullable = false)
	private String bankId;

	@Column(name = "portfolio_code", nullable = false)
	private String portfolioCode;

	@Column(name = "account_number")
	private String accountNumber;

	@Column(name = "snapshot_date", nullable = false)
	private LocalDate snapshotDate;

	@Column(name = "file_date")
	private LocalDate fileDate;

	@Column(name = "source_file")
	private String sourceFile;

	@Column(name = "total_market_value", nullable = false)
	private BigDecimal totalMarketValue;

	@Column(name = "cash_balance", nullable = false)
	private BigDecimal cashBalance;

	@Column(name = "total_account_value", nullable = false)
	private BigDecimal totalAccountValue;

	@Column(name = "position_count", nullable = false)
	private int positionCount;

	@Column(name = "currency")
	private String currency;

	@Column(name = "has_mixed_currencies", nullable = false)
	private boolean hasMixedCurrencies;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "asset_class_breakdown", nullable = false)
	private Map<String, BigDecimal> assetClassBreakdown = new LinkedHashMap<>();

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getSnapshotId() {
		return snapshotId;
	}

	public void setSnapshotId(Long snapshotId) {
		this.snapshotId = snapshotId;
	}

	public Long getOwnerId() {
		return ownerId;
	}

	public void setOwnerId(Long ownerId) {
		this.ownerId = ownerId;
	}

	public String getBankId() {
		return bankId;
	}

	public void setBankId(String bankId) {
		this.bankId = bankId;
	}

	public String getPortfolioCode() {
		return portfolioCode;
	}

	public void setPortfolioCode(String portfolioCode) {
		this.portfolioCode = portfolioCode;
	}

	public String getAccountNumber() {
		return accountNumber;
	}

	public void setAccountNumber(String accountNumber) {
		this.accountNumber = accountNumber;
	}

	public LocalDate getSnapshotDate() {
		return snapshotDate;
	}

	public void setSnapshotDate(LocalDate snapshotDate) {
		this.snapshotDate = snapshotDate;
	}

	public LocalDate getFileDate() {
		return fileDate;
	}

	public void setFileDate(LocalDate fileDate) {
		this.fileDate = fileDate;
	}

	public String getSourceFile() {
		return sourceFile;
	}

	public void setSourceFile(String sourceFile) {
		this.sourceFile = sourceFile;
	}

	public BigDecimal getTotalMarketValue() {
		return totalMarketValue;
	}

	public void setTotalMarketValue(BigDecimal totalMarketValue) {
		this.totalMarketValue = totalMarketValue;
	}

	public BigDecimal getCashBalance() {
		return cashBalance;
	}

	public void setCashBalance(BigDecimal cashBalance) {
		this.cashBalance = cashBalance;
	}

	public BigDecimal getTotalAccountValue() {
		return totalAccountValue;
	}

	public void setTotalAccountValue(BigDecimal totalAccountValue) {
		this.totalAccountValue = totalAccountValue;
	}

	public int getPositionCount() {
		return positionCount;
	}

	public void setPositionCount(int positionCount) {
		this.positionCount = positionCount;
	}

	public String getCurrency() {
		return currency;
	}

	public void setCurrency(String currency) {
		this.currency = currency;
	}

	public boolean isHasMixedCurrencies() {
		return hasMixedCurrencies;
	}

	public void setHasMixedCurrencies(boolean hasMixedCurrencies) {
		this.hasMixedCurrencies = hasMixedCurrencies;
	}

	public Map<String, BigDecimal> getAssetClassBreakdown() {
		return assetClassBreakdown;
	}

	public void setAssetClassBreakdown(Map<String, BigDecimal> assetClassBreakdown) {
		this.assetClassBreakdown = assetClassBreakdown;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
