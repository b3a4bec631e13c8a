package my.custodyreconciler.app.repository;

import my.custodyreconciler.app.domain.Allocation;
import my.custodyreconciler.app.domain.AllocationSource;
import my.custodyreconciler.app.domain.AllocationStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AllocationRepository extends JpaRepository<Allocation, Long> {
	Optional<Allocation> findFirstByProductIdAndClientIdOrderByAllocationIdDesc(Long productId, Long clientId);

	List<Allocation> findByBankAccountIdAndStatusAndSource(Long bankAccountId, AllocationStatus status,
														   AllocationSource source);
}
