package my.custodyreconciler.app.repository;

import my.custodyreconciler.app.domain.ImportRun;
import my.custodyreconciler.app.domain.ImportRunStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface ImportRunRepository extends JpaRepository<ImportRun, Long> {
	List<ImportRun> findTop50ByOrderByStartedAtDesc();

	List<ImportRun> findTop50ByBankIdOrderByStartedAtDesc(String bankId);

	boolean existsByBankIdAndSourceFileAndStatusIn(String bankId, String sourceFile, Collection<ImportRunStatus> statuses);
}
