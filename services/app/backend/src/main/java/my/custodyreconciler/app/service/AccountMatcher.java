package my.custodyreconciler.app.service;

import my.custodyreconciler.app.domain.BankAccount;
import my.custodyreconciler.app.repository.BankAccountRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps an external portfolio code to the internal bank account that owns it. Custodians append a
 * settlement leg ({@code PF-7-1}) to the account number; the exact code is tried before the stripped one
 * so account numbers that themselves end in {@code -N} still match.
 */
@Service
public class AccountMatcher {
	private static final Pattern LEG_SUFFIX = Pattern.compile("-\\d+$");
	private final BankAccountRepository bankAccountRepository;

	public AccountMatcher(BankAccountRepository bankAccountRepository) {
		this.bankAccountRepository = bankAccountRepository;
	}

	public Optional<BankAccount> resolve(String portfolioCode, String bankId) {
		if (portfolioCode == null || portfolioCode.isBlank() || bankId == null) {
			return Optional.empty();
		}
		String code = portfolioCode.trim();
		Optional<BankAccount> exact = bankAccountRepository.findFirstByAccountNumberAndBankIdAndActiveTrue(code, bankId);
		if (exact.isPresent()) {
			return exact;
		}
		String stripped = stripSettlementLeg(code);
		if (stripped.equals(code)) {
			return Optional.empty();
		}
		return bankAccountRepository.findFirstByAccountNumberAndBankIdAndActiveTrue(stripped, bankId);
	}

	public Long match(String portfolioCode, String bankId) {
		return resolve(portfolioCode, bankId).map(BankAccount::getOwnerId).orElse(null);
	}

	static String stripSettlementLeg(String portfolioCode) {
		return LEG_SUFFIX.matcher(portfolioCode).replaceFirst("");
	}
}
