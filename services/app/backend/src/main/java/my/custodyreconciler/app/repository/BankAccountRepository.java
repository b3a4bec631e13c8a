package my.custodyreconciler.app.repository;

import my.custodyreconciler.app.domain.BankAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface BankAccountRepository extends JpaRepository<BankAccount, Long> {
	Optional<BankAccount> findFirstByAccountNumberAndBankIdAndActiveTrue(String accountNumber, String bankId);
}
