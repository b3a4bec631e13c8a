package my.custodyreconciler.app.repository;

import my.custodyreconciler.app.domain.Holding;
import my.custodyreconciler.app.domain.HoldingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface HoldingRepository extends JpaRepository<Holding, Long> {
	Optional<Holding> findFirstByUniqueKeyAndLatestTrue(String uniqueKey);

	List<Holding> findByBankIdAndPortfolioCodeAndLatestTrueAndStatus(String bankId, String portfolioCode,
																	 HoldingStatus status);

	@Query("""
			select max(h.fileDate) from Holding h
			where h.bankId = :bankId and h.portfolioCode = :portfolioCode
			""")
	LocalDate findMaxFileDate(@Param("bankId") String bankId, @Param("portfolioCode") String portfolioCode);
}
