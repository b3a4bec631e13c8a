package my.custodyreconciler.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "account_profiles")
public class AccountProfile {
	@Id
	@Column(name = "bank_account_id")
	private Long bankAccountId;

	@Column(name = "max_cash", nullable = false)
	private BigDecimal maxCash;

	@Column(name = "max_bonds", nullable = false)
	private BigDecimal maxBonds;

	@Column(name = "max_equities", nullable = false)
	private BigDecimal maxEquities;

	@Column(name = "max_alternative", nullable = false)
	private BigDecimal maxAlternative;

	@Column(name = "updated_at")
	private LocalDateTime updatedAt;

	@Column(name = "updated_by")
	private String updatedBy;

	public Long getBankAccountId() {
		return bankAccountId;
	}

	public void setBankAccountId(Long bankAccountId) {
		this.bankAccountId = bankAccountId;
	}

	public BigDecimal getMaxCash() {
		return maxCash;
	}

	public void setMaxCash(BigDecimal maxCash) {
		this.maxCash = maxCash;
	}

	public BigDecimal getMaxBonds() {
		return maxBonds;
	}

	public void setMaxBonds(BigDecimal maxBonds) {
		this.maxBonds = maxBonds;
	}

	public BigDecimal getMaxEquities() {
		return maxEquities;
	}

	public void setMaxEquities(BigDecimal maxEquities) {
		this.maxEquities = maxEquities;
	}

	public BigDecimal getMaxAlternative() {
		return maxAlternative;
	}

	public void setMaxAlternative(BigDecimal maxAlternative) {
		this.maxAlternative = maxAlternative;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}

	public String getUpdatedBy() {
		return updatedBy;
	}

	public void setUpdatedBy(String updatedBy) {
		this.updatedBy = updatedBy;
	}
}
