package my.custodyreconciler.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "allocations")
public class Allocation {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "allocation_id")
	private Long allocationId;

	@Column(name = "product_id", nullable = false)
	private Long productId;

	@Column(name = "client_id", nullable = false)
	private Long clientId;

	@Column(name = "bank_account_id")
	private Long bankAccountId;

	@Column(name = "nominal_invested", nullable = false)
	private BigDecimal nominalInvested;

	@Column(name = "purchase_price", nullable = false)
	private BigDecimal purchasePrice;

	@Column(name = "quantity")
	private BigDecimal quantity;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private AllocationStatus status;

	@Enumerated(EnumType.STRING)
	@Column(name = "source", nullable = false)
	private AllocationSource source;

	@Column(name = "allocated_at", nullable = false)
	private LocalDateTime allocatedAt;

	@Column(name = "allocated_by")
	private String allocatedBy;

	@Column(name = "auto_allocated_from_file")
	private String autoAllocatedFromFile;

	@Column(name = "last_seen_in_bank_file")
	private LocalDate lastSeenInBankFile;

	@Column(name = "redeemed_at")
	private LocalDate redeemedAt;

	@Column(name = "redemption_value")
	private BigDecimal redemptionValue;

	@Column(name = "notes")
	private String notes;

	public Long getAllocationId() {
		return allocationId;
	}

	public void setAllocationId(Long allocationId) {
		this.allocationId = allocationId;
	}

	public Long getProductId() {
		return productId;
	}

	public void setProductId(Long productId) {
		this.productId = productId;
	}

	public Long getClientId() {
		return clientId;
	}

	public void setClientId(Long clientId) {
		this.clientId = clientId;
	}

	public Long getBankAccountId() {
		return bankAccountId;
	}

	public void setBankAccountId(Long bankAccountId) {
		this.bankAccountId = bankAccountId;
	}

	public BigDecimal getNominalInvested() {
		return nominalInvested;
	}

	public void setNominalInvested(BigDecimal nominalInvested) {
		this.nominalInvested = nominalInvested;
	}

	public BigDecimal getPurchasePrice() {
		return purchasePrice;
	}

	public void setPurchasePrice(BigDecimal purchasePrice) {
		this.purchasePrice = purchasePrice;
	}

	public BigDecimal getQuantity() {
		return quantity;
	}

	public void setQuantity(BigDecimal quantity) {
		this.quantity = quantity;
	}

	public AllocationStatus getStatus() {
		return status;
	}

	public void setStatus(AllocationStatus status) {
		this.status = status;
	}

	public AllocationSource getSource() {
		return source;
	}

	public void setSource(AllocationSource source) {
		this.source = source;
	}

	public LocalDateTime getAllocatedAt() {
		return allocatedAt;
	}

	public void setAllocatedAt(LocalDateTime allocatedAt) {
		this.allocatedAt = allocatedAt;
	}

	public String getAllocatedBy() {
		return allocatedBy;
	}

	public void setAllocatedBy(String allocatedBy) {
		this.allocatedBy = allocatedBy;
	}

	public String getAutoAllocatedFromFile() {
		return autoAllocatedFromFile;
	}

	public void setAutoAllocatedFromFile(String autoAllocatedFromFile) {
		this.autoAllocatedFromFile = autoAllocatedFromFile;
	}

	public LocalDate getLastSeenInBankFile() {
		return lastSeenInBankFile;
	}

	public void setLastSeenInBankFile(LocalDate lastSeenInBankFile) {
		this.lastSeenInBankFile = lastSeenInBankFile;
	}

	public LocalDate getRedeemedAt() {
		return redeemedAt;
	}

	public void setRedeemedAt(LocalDate redeemedAt) {
		this.redeemedAt = redeemedAt;
	}

	public BigDecimal getRedemptionValue() {
		return redemptionValue;
	}

	public void setRedemptionValue(BigDecimal redemptionValue) {
		this.redemptionValue = redemptionValue;
	}

	public String getNotes() {
		return notes;
	}

	public void setNotes(String notes) {
		this.notes = notes;
	}
}
