package my.custodyreconciler.app.repository;

import my.custodyreconciler.app.domain.PortfolioSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface PortfolioSnapshotRepository extends JpaRepository<PortfolioSnapshot, Long> {
	Optional<PortfolioSnapshot> findByOwnerIdAndPortfolioCodeAndSnapshotDate(Long ownerId, String portfolioCode,
																			 LocalDate snapshotDate);

	List<PortfolioSnapshot> findByOwnerIdAndSnapshotDateBetweenOrderBySnapshotDateDesc(Long ownerId, LocalDate from,
																					   LocalDate to);

	List<PortfolioSnapshot> findByOwnerIdAndPortfolioCodeAndSnapshotDateBetweenOrderBySnapshotDateDesc(
			Long ownerId, String portfolioCode, LocalDate from, LocalDate to);
}
