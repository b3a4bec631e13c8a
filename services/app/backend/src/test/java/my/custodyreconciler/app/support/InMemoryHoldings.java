package my.custodyreconciler.app.support;

import my.custodyreconciler.app.domain.Holding;
import my.custodyreconciler.app.domain.HoldingStatus;
import my.custodyreconciler.app.repository.HoldingRepository;
import org.mockito.quality.Strictness;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

/**
 * A {@link HoldingRepository} mock that answers the finder methods from a list, so reconciliation runs can
 * be chained like against a database.
 */
public final class InMemoryHoldings {
	private final List<Holding> rows = new ArrayList<>();
	private final AtomicLong ids = new AtomicLong(100);
	private final HoldingRepository repository;

	public InMemoryHoldings() {
		repository = mock(HoldingRepository.class, withSettings().strictness(Strictness.LENIENT));
		when(repository.save(any(Holding.class))).thenAnswer(invocation -> save(invocation.getArgument(0)));
		when(repository.findFirstByUniqueKeyAndLatestTrue(anyString())).thenAnswer(invocation ->
				latest(invocation.getArgument(0)));
		when(repository.findByBankIdAndPortfolioCodeAndLatestTrueAndStatus(anyString(), anyString(), any()))
				.thenAnswer(invocation -> portfolio(invocation.getArgument(0), invocation.getArgument(1),
						invocation.getArgument(2)));
		when(repository.findMaxFileDate(anyString(), anyString())).thenAnswer(invocation ->
				maxFileDate(invocation.getArgument(0), invocation.getArgument(1)));
	}

	public HoldingRepository repository() {
		return repository;
	}

	public List<Holding> all() {
		return List.copyOf(rows);
	}

	public List<Holding> latest() {
		return rows.stream().filter(Holding::isLatest).toList();
	}

	public Holding add(Holding holding) {
		return save(holding);
	}

	private synchronized Holding save(Holding holding) {
		if (holding.getHoldingId() == null) {
			holding.setHoldingId(ids.incrementAndGet());
		}
		if (rows.stream().noneMatch(row -> row == holding)) {
			rows.add(holding);
		}
		return holding;
	}

	private synchronized Optional<Holding> latest(String uniqueKey) {
		return rows.stream()
				.filter(row -> row.isLatest() && Objects.equals(row.getUniqueKey(), uniqueKey))
				.findFirst();
	}

	private synchronized List<Holding> portfolio(String bankId, String portfolioCode, HoldingStatus status) {
		return rows.stream()
				.filter(row -> row.isLatest() && row.getStatus() == status)
				.filter(row -> Objects.equals(row.getBankId(), bankId) && Objects.equals(row.getPortfolioCode(), portfolioCode))
				.toList();
	}

	private synchronized LocalDate maxFileDate(String bankId, String portfolioCode) {
		return rows.stream()
				.filter(row -> Objects.equals(row.getBankId(), bankId) && Objects.equals(row.getPortfolioCode(), portfolioCode))
				.map(Holding::getFileDate)
				.filter(Objects::nonNull)
				.max(Comparator.naturalOrder())
				.orElse(null);
	}
}
