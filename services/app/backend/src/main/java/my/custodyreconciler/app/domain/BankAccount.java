package my.custodyreconciler.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "bank_accounts")
public class BankAccount {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "bank_account_id")
	private Long bankAccountId;

	@Column(name = "bank_id", nullable = false)
	private String bankId;

	@Column(name = "account_number", nullable = false)
	private String accountNumber;

	@Column(name = "owner_id", nullable = false)
	private Long ownerId;

	@Column(name = "reference_currency")
	private String referenceCurrency;

	@Column(name = "authorized_overdraft")
	private BigDecimal authorizedOverdraft;

	@Column(name = "is_active", nullable = false)
	private boolean active;

	public Long getBankAccountId() {
		return bankAccountId;
	}

	public void setBankAccountId(Long bankAccountId) {
		this.bankAccountId = bankAccountId;
	}

	public String getBankId() {
		return bankId;
	}

	public void setBankId(String bankId) {
		this.bankId = bankId;
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

	public String getReferenceCurrency() {
		return referenceCurrency;
	}

	public void setReferenceCurrency(String referenceCurrency) {
		this.referenceCurrency = referenceCurrency;
	}

	public BigDecimal getAuthorizedOverdraft() {
		return authorizedOverdraft;
	}

	public void setAuthorizedOverdraft(BigDecimal authorizedOverdraft) {
		this.authorizedOverdraft = authorizedOverdraft;
	}

	public boolean isActive() {
		return active;
	}

	public void setActive(boolean active) {
		this.active = active;
	}
}
