package my.custodyreconciler.app.repository;

import my.custodyreconciler.app.domain.AlertEventType;
import my.custodyreconciler.app.domain.RiskAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface RiskAlertRepository extends JpaRepository<RiskAlert, Long> {
	boolean existsByEventTypeAndBankAccountIdAndPortfolioCodeAndCreatedAtAfter(AlertEventType eventType,
																			   Long bankAccountId,
																			   String portfolioCode,
																			   LocalDateTime createdAfter);

	@Modifying
	@Query("""
			delete from RiskAlert a
			where a.eventType = :eventType
			and a.bankAccountId = :bankAccountId
			and a.portfolioCode = :portfolioCode
			""")
	int deleteByMatchKey(@Param("eventType") AlertEventType eventType,
						 @Param("bankAccountId") Long bankAccountId,
						 @Param("portfolioCode") String portfolioCode);

	List<RiskAlert> findAllByOrderByCreatedAtDesc();

	List<RiskAlert> findByEventTypeOrderByCreatedAtDesc(AlertEventType eventType);

	List<RiskAlert> findByBankAccountIdOrderByCreatedAtDesc(Long bankAccountId);

	List<RiskAlert> findByEventTypeAndBankAccountIdOrderByCreatedAtDesc(AlertEventType eventType, Long bankAccountId);
}
