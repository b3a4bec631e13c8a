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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "holdings")
public class Holding {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "holding_id")
	private Long holdingId;

	@Column(name = "unique_key", nullable = false)
	private String uniqueKey;

	@Column(name = "bank_id", nullable = false)
	private String bankId;

	@Column(name = "portfolio_code", nullable = false)
	private String portfolioCode;

	@Column(name = "account_number")
	private String accountNumber;

	@Column(name = "owner_id", nullable = false)
	private Long ownerId;

	@Column(name = "bank_account_id")
	private Long bankAccountId;

	@Column(name = "isin")
	private String isin;

	@Column(name = "position_number")
	private String positionNumber;

	@Column(name = "instrument_code")
	private String instrumentCode;

	@Column(name = "security_name")
	private String securityName;

	@Column(name = "asset_class")
	private String assetClass;

	@Column(name = "security_type")
	private String securityType;

	@Column(name = "currency")
	private String currency;

	@Column(name = "quantity")
	private BigDecimal quantity;

	@Column(name = "market_price")
	private BigDecimal marketPrice;

	@Column(name = "market_value")
	private BigDecimal marketValue;

	@Column(name = "cost_price")
	private BigDecimal costPrice;

	@Column(name = "snapshot_date", nullable = false)
	private LocalDate snapshotDate;

	@Column(name = "file_date", nullable = false)
	private LocalDate fileDate;

	@Column(name = "source_file")
	private String sourceFile;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "bank_specific_data")
	private Map<String, Object> bankSpecificData = new LinkedHashMap<>();

	@Column(name = "is_latest", nullable = false)
	private boolean latest;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private HoldingStatus status;

	@Column(name = "sold_at")
	private LocalDate soldAt;

	@Column(name = "sold_reason")
	private String soldReason;

	@Column(name = "version", nullable = false)
	private int version;

	@Column(name = "linked_product_id")
	private Long linkedProductId;

	@Column(name = "linked_allocation_id")
	private Long linkedAllocationId;

	@Enumerated(EnumType.STRING)
	@Column(name = "linking_status", nullable = false)
	private LinkingStatus linkingStatus;

	@Column(name = "linked_at")
	private LocalDateTime linkedAt;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getHoldingId() {
		return holdingId;
	}

	public void setHoldingId(Long holdingId) {
		this.holdingId = holdingId;
	}

	public String getUniqueKey() {
		return uniqueKey;
	}

	public void setUniqueKey(String uniqueKey) {
		this.uniqueKey = uniqueKey;
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

	public Long getOwnerId() {
		return ownerId;
	}

	public void setOwnerId(Long ownerId) {
		this.ownerId = ownerId;
	}

	public Long getBankAccountId() {
		return bankAccountId;
	}

	public void setBankAccountId(Long bankAccountId) {
		this.bankAccountId = bankAccountId;
	}

	public String getIsin() {
		return isin;
	}

	public void setIsin(String isin) {
		this.isin = isin;
	}

	public String getPositionNumber() {
		return positionNumber;
	}

	public void setPositionNumber(String positionNumber) {
		this.positionNumber = positionNumber;
	}

	public String getInstrumentCode() {
		return instrumentCode;
	}

	public void setInstrumentCode(String instrumentCode) {
		this.instrumentCode = instrumentCode;
	}

	public String getSecurityName() {
		return securityName;
	}

	public void setSecurityName(String securityName) {
		this.securityName = securityName;
	}

	public String getAssetClass() {
		return assetClass;
	}

	public void setAssetClass(String assetClass) {
		this.assetClass = assetClass;
	}

	public String getSecurityType() {
		return securityType;
	}

	public void setSecurityType(String securityType) {
		this.securityType = securityType;
	}

	public String getCurrency() {
		return currency;
	}

	public void setCurrency(String currency) {
		this.currency = currency;
	}

	public BigDecimal getQuantity() {
		return quantity;
	}

	public void setQuantity(BigDecimal quantity) {
		this.quantity = quantity;
	}

	public BigDecimal getMarketPrice() {
		return marketPrice;
	}

	public void setMarketPrice(BigDecimal marketPrice) {
		this.marketPrice = marketPrice;
	}

	public BigDecimal getMarketValue() {
		return marketValue;
	}

	public void setMarketValue(BigDecimal marketValue) {
		this.marketValue = marketValue;
	}

	public BigDecimal getCostPrice() {
		return costPrice;
	}

	public void setCostPrice(BigDecimal costPrice) {
		this.costPrice = costPrice;
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

	public Map<String, Object> getBankSpecificData() {
		return bankSpecificData;
	}

	public void setBankSpecificData(Map<String, Object> bankSpecificData) {
		this.bankSpecificData = bankSpecificData;
	}

	public boolean isLatest() {
		return latest;
	}

	public void setLatest(boolean latest) {
		this.latest = latest;
	}

	public HoldingStatus getStatus() {
		return status;
	}

	public void setStatus(HoldingStatus status) {
		this.status = status;
	}

	public LocalDate getSoldAt() {
		return soldAt;
	}

	public void setSoldAt(LocalDate soldAt) {
		this.soldAt = soldAt;
	}

	public String getSoldReason() {
		return soldReason;
	}

	public void setSoldReason(String soldReason) {
		this.soldReason = soldReason;
	}

	public int getVersion() {
		return version;
	}

	public void setVersion(int version) {
		this.version = version;
	}

	public Long getLinkedProductId() {
		return linkedProductId;
	}

	public void setLinkedProductId(Long linkedProductId) {
		this.linkedProductId = linkedProductId;
	}

	public Long getLinkedAllocationId() {
		return linkedAllocationId;
	}

	public void setLinkedAllocationId(Long linkedAllocationId) {
		this.linkedAllocationId = linkedAllocationId;
	}

	public LinkingStatus getLinkingStatus() {
		return linkingStatus;
	}

	public void setLinkingStatus(LinkingStatus linkingStatus) {
		this.linkingStatus = linkingStatus;
	}

	public LocalDateTime getLinkedAt() {
		return linkedAt;
	}

	public void setLinkedAt(LocalDateTime linkedAt) {
		this.linkedAt = linkedAt;
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

	public boolean isActive() {
		return status == HoldingStatus.ACTIVE;
	}
}
