package my.custodyreconciler.app.service;

import my.custodyreconciler.app.domain.Allocation;
import my.custodyreconciler.app.domain.AllocationSource;
import my.custodyreconciler.app.domain.AllocationStatus;
import my.custodyreconciler.app.domain.BankAccount;
import my.custodyreconciler.app.domain.Holding;
import my.custodyreconciler.app.domain.HoldingStatus;
import my.custodyreconciler.app.domain.ImportRun;
import my.custodyreconciler.app.domain.ImportRunStatus;
import my.custodyreconciler.app.domain.Product;
import my.custodyreconciler.app.dto.ImportErrorDto;
import my.custodyreconciler.app.dto.ImportResultDto;
import my.custodyreconciler.app.importer.BankPosition;
import my.custodyreconciler.app.importer.FeedUnavailableException;
import my.custodyreconciler.app.importer.PositionBatch;
import my.custodyreconciler.app.importer.PositionFeed;
import my.custodyreconciler.app.repository.AllocationRepository;
import my.custodyreconciler.app.repository.BankAccountRepository;
import my.custodyreconciler.app.repository.ImportRunRepository;
import my.custodyreconciler.app.repository.ProductRepository;
import my.custodyreconciler.app.support.InMemoryHoldings;
import my.custodyreconciler.app.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static my.custodyreconciler.app.support.TestPositions.BANK;
import static my.custodyreconciler.app.support.TestPositions.account;
import static my.custodyreconciler.app.support.TestPositions.holding;
import static my.custodyreconciler.app.support.TestPositions.position;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PositionImportServiceTest {
	private static final LocalDate DAY_1 = LocalDate.of(2025, 3, 14);
	private static final LocalDate DAY_2 = LocalDate.of(2025, 3, 15);

	private final BankAccountRepository bankAccountRepository = mock(BankAccountRepository.class);
	private final ProductCatalog productCatalog = mock(ProductCatalog.class);
	private final AllocationLinkService allocationLinkService = mock(AllocationLinkService.class);
	private final AllocationRepository allocationRepository = mock(AllocationRepository.class);
	private final ProductRepository productRepository = mock(ProductRepository.class);
	private final PortfolioSnapshotService snapshotService = mock(PortfolioSnapshotService.class);
	private final RiskMonitorService riskMonitorService = mock(RiskMonitorService.class);
	private final ImportRunRepository importRunRepository = mock(ImportRunRepository.class);
	private final PositionFeed positionFeed = mock(PositionFeed.class);
	private final List<ImportRun> runs = new ArrayList<>();
	private final BankAccount account = account(3L, "PF-7", 42L);

	private InMemoryHoldings holdings;
	private PositionImportService importService;

	@BeforeEach
	void setUp() {
		holdings = new InMemoryHoldings();
		AccountMatcher accountMatcher = new AccountMatcher(bankAccountRepository);
		PositionReconciler reconciler = new PositionReconciler(accountMatcher, holdings.repository(),
				TestProperties.defaults());
		importService = new PositionImportService(accountMatcher, new PositionEnrichmentService(productCatalog),
				reconciler, allocationLinkService, snapshotService, riskMonitorService, holdings.repository(),
				importRunRepository, positionFeed, new TaskExecutorAdapter(Runnable::run), TestProperties.defaults());

		when(bankAccountRepository.findFirstByAccountNumberAndBankIdAndActiveTrue("PF-7", BANK))
				.thenReturn(Optional.of(account));
		AtomicLong runIds = new AtomicLong();
		when(importRunRepository.save(any(ImportRun.class))).thenAnswer(invocation -> {
			ImportRun run = invocation.getArgument(0);
			if (run.getRunId() == null) {
				run.setRunId(runIds.incrementAndGet());
				runs.add(run);
			}
			return run;
		});
	}

	@Test
	void mixedBatchReportsUnmappedAndInvalidPositions() {
		PositionBatch batch = batch(DAY_1,
				position("PF-7-1", "DE0005140008", "EUR", "1000"),
				position("PF-7-1", "US0378331005", "USD", "2000"),
				position("PF-999", "CH0012345678", "CHF", "10"),
				position("PF-7-1", "XS0000000001", null, "10"));

		ImportResultDto result = importService.importBatch(batch, "ops");

		assertThat(result.status()).isEqualTo(ImportRunStatus.COMPLETED_WITH_ISSUES.name());
		assertThat(result.totalRecords()).isEqualTo(4);
		assertThat(result.created()).isEqualTo(2);
		assertThat(result.skipped()).isEqualTo(2);
		assertThat(result.unmappedCodes()).containsExactly("PF-999");
		assertThat(result.errors()).extracting(ImportErrorDto::error).containsExactly("currency is required");
		assertThat(result.snapshots()).isEqualTo(1);
		assertThat(holdings.all()).hasSize(2).allSatisfy(holding -> {
			assertThat(holding.getOwnerId()).isEqualTo(42L);
			assertThat(holding.getPortfolioCode()).isEqualTo("PF-7-1");
		});
		ImportRun run = runs.get(0);
		assertThat(run.getStatus()).isEqualTo(ImportRunStatus.COMPLETED_WITH_ISSUES);
		assertThat(run.getTriggeredBy()).isEqualTo("ops");
		assertThat(run.getCreatedCount()).isEqualTo(2);
		assertThat(run.getSkippedCount()).isEqualTo(2);
		assertThat(run.getUnmappedCodes()).containsExactly("PF-999");
		assertThat(run.getErrors()).singleElement().satisfies(error ->
				assertThat(error).containsEntry("isin", "XS0000000001").containsEntry("error", "currency is required"));
		assertThat(run.getFinishedAt()).isNotNull();
		verify(riskMonitorService).evaluate(any(RiskMonitorService.PortfolioScope.class), anyList(), isNull());
	}

	@Test
	void cleanBatchCompletesAndDrivesLaterStages() {
		ImportResultDto result = importService.importBatch(batch(DAY_1,
				position("PF-7", "DE0005140008", "EUR", "1000"),
				position("PF-7", "US0378331005", "USD", "2000")), null);

		assertThat(result.status()).isEqualTo(ImportRunStatus.COMPLETED.name());
		assertThat(runs.get(0).getTriggeredBy()).isEqualTo(PositionImportService.DEFAULT_ACTOR);
		verify(allocationLinkService, times(2)).link(any(Holding.class), eq(account));
		verify(allocationLinkService).redeemMissing(account, Set.of("DE0005140008", "US0378331005"), DAY_1);
		verify(snapshotService).snapshot(eq(42L), eq(BANK), eq("PF-7"), anyList(), eq(DAY_1));
	}

	@Test
	void reimportOfSameFileChangesNothing() {
		importService.importBatch(batch(DAY_1,
				position("PF-7", "DE0005140008", "EUR", "1000"),
				position("PF-7", "US0378331005", "USD", "2000")), "ops");

		ImportResultDto second = importService.importBatch(batch(DAY_2,
				position("PF-7", "DE0005140008", "EUR", "1000"),
				position("PF-7", "US0378331005", "USD", "2000")), "ops");

		assertThat(second.status()).isEqualTo(ImportRunStatus.COMPLETED.name());
		assertThat(second.created()).isZero();
		assertThat(second.updated()).isZero();
		assertThat(second.unchanged()).isEqualTo(2);
		assertThat(second.sold()).isZero();
		assertThat(holdings.all()).hasSize(2);
	}

	@Test
	void positionMissingFromNextFileIsSold() {
		importService.importBatch(batch(DAY_1,
				position("PF-7", "DE0005140008", "EUR", "1000"),
				position("PF-7", "US0378331005", "USD", "2000")), "ops");

		ImportResultDto second = importService.importBatch(batch(DAY_2,
				position("PF-7", "DE0005140008", "EUR", "1000")), "ops");

		assertThat(second.sold()).isEqualTo(1);
		assertThat(holdings.all()).filteredOn(holding -> holding.getStatus() == HoldingStatus.SOLD)
				.extracting(Holding::getIsin).containsExactly("US0378331005");
	}

	@Test
	void olderFileThanStoredIsSkippedPerPortfolio() {
		Holding stored = holding("PF-7", "DE0005140008", "equity", "EUR", "1000");
		stored.setFileDate(DAY_2);
		holdings.add(stored);

		ImportResultDto result = importService.importBatch(batch(DAY_1,
				position("PF-7", "US0378331005", "USD", "2000")), "ops");

		assertThat(result.status()).isEqualTo(ImportRunStatus.COMPLETED_WITH_ISSUES.name());
		assertThat(result.created()).isZero();
		assertThat(result.skipped()).isEqualTo(1);
		assertThat(result.errors()).singleElement()
				.satisfies(error -> assertThat(error.error()).startsWith(PositionImportService.OUT_OF_ORDER));
		assertThat(stored.getStatus()).isEqualTo(HoldingStatus.ACTIVE);
		assertThat(holdings.all()).hasSize(1);
	}

	@Test
	void storageFailureFailsRunAndSignalsRetry() {
		when(snapshotService.snapshot(any(), any(), any(), anyList(), any()))
				.thenThrow(new DataAccessResourceFailureException("connection refused"));

		assertThatThrownBy(() -> importService.importBatch(batch(DAY_1,
				position("PF-7", "DE0005140008", "EUR", "1000")), "ops"))
				.isInstanceOf(ImportPipelineException.class)
				.hasMessageContaining("safe to retry")
				.hasCauseInstanceOf(DataAccessResourceFailureException.class);

		ImportRun run = runs.get(0);
		assertThat(run.getStatus()).isEqualTo(ImportRunStatus.FAILED);
		assertThat(run.getFailureMessage()).contains("connection refused");
	}

	@Test
	void stageFailuresBecomeIssuesWithoutStoppingTheRun() {
		when(allocationLinkService.link(any(Holding.class), any(BankAccount.class)))
				.thenThrow(new IllegalStateException("catalog mismatch"));
		when(riskMonitorService.evaluate(any(), anyList(), any())).thenThrow(new IllegalStateException("no profile table"));

		ImportResultDto result = importService.importBatch(batch(DAY_1,
				position("PF-7", "DE0005140008", "EUR", "1000")), "ops");

		assertThat(result.status()).isEqualTo(ImportRunStatus.COMPLETED_WITH_ISSUES.name());
		assertThat(result.created()).isEqualTo(1);
		assertThat(result.skipped()).isZero();
		assertThat(result.errors()).extracting(ImportErrorDto::error)
				.containsExactly("linking_failed: catalog mismatch", "risk_check_failed: no profile table");
	}

	@Test
	void positionOfOtherBankIsRejected() {
		BankPosition foreign = new BankPosition("bank_b", "PF-7", null, "DE0005140008", null, null, "Deutsche Bank",
				"equity", "stock", "EUR", BigDecimal.ONE, BigDecimal.TEN, BigDecimal.TEN, null, DAY_1, Map.of());

		ImportResultDto result = importService.importBatch(batch(DAY_1,
				foreign, position("PF-7", "US0378331005", "USD", "2000")), "ops");

		assertThat(result.created()).isEqualTo(1);
		assertThat(result.skipped()).isEqualTo(1);
		assertThat(result.errors()).extracting(ImportErrorDto::error).containsExactly("position belongs to bank bank_b");
	}

	@Test
	void emptyBatchIsRejectedBeforeAnyRun() {
		assertThatThrownBy(() -> importService.importBatch(new PositionBatch(BANK, DAY_1, "empty.csv", List.of()), "ops"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> importService.importBatch(new PositionBatch(BANK, null, "x.csv",
				List.of(position("PF-7", "DE0005140008", "EUR", "1"))), "ops"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("fileDate");
		assertThat(runs).isEmpty();
	}

	@Test
	void alreadyImportedFeedFileIsSkipped() {
		when(positionFeed.readLatest(BANK)).thenReturn(batch(DAY_1, position("PF-7", "DE0005140008", "EUR", "1000")));
		when(importRunRepository.existsByBankIdAndSourceFileAndStatusIn(eq(BANK), eq("positions_20250314.csv"), anyCollection()))
				.thenReturn(true);

		assertThat(importService.importNewFromFeed(BANK, "scheduler")).isEmpty();
		assertThat(runs).isEmpty();
		assertThat(holdings.all()).isEmpty();
	}

	@Test
	void newFeedFileIsImported() {
		when(positionFeed.readLatest(BANK)).thenReturn(batch(DAY_1, position("PF-7", "DE0005140008", "EUR", "1000")));
		when(importRunRepository.existsByBankIdAndSourceFileAndStatusIn(eq(BANK), eq("positions_20250314.csv"), anyCollection()))
				.thenReturn(false);

		Optional<ImportResultDto> result = importService.importNewFromFeed(BANK, "scheduler");

		assertThat(result).hasValueSatisfying(dto -> assertThat(dto.created()).isEqualTo(1));
		assertThat(runs.get(0).getTriggeredBy()).isEqualTo("scheduler");
	}

	@Test
	void unavailableFeedIsRecordedAsFailedRun() {
		when(positionFeed.readLatest(BANK)).thenThrow(new FeedUnavailableException("No position file for bank bank_a"));

		assertThatThrownBy(() -> importService.importLatestFromFeed(BANK, "ops"))
				.isInstanceOf(FeedUnavailableException.class);
		assertThat(runs).singleElement().satisfies(run -> {
			assertThat(run.getStatus()).isEqualTo(ImportRunStatus.FAILED);
			assertThat(run.getFailureMessage()).contains("No position file");
		});
		verify(allocationLinkService, never()).redeemMissing(any(), any(), any());
	}

	@Test
	void productHeldInAnotherAccountOfTheClientIsNotRedeemed() {
		BankAccount secondAccount = account(4L, "PF-8", 42L);
		when(bankAccountRepository.findFirstByAccountNumberAndBankIdAndActiveTrue("PF-8", BANK))
				.thenReturn(Optional.of(secondAccount));
		when(productCatalog.lookupByIsin("CH0000000017")).thenReturn(Optional.of(new ProductClassification(17L,
				"CH0000000017", "Phoenix on SMI 2027", "Phoenix Autocallable", "structured_product", "Vontobel",
				"equity_linked", "capital_protected_conditional", false, false, true)));
		Product product = new Product();
		product.setProductId(17L);
		product.setIsin("CH0000000017");
		when(productRepository.findAllById(any())).thenReturn(List.of(product));

		Allocation allocation = new Allocation();
		allocation.setAllocationId(5L);
		allocation.setProductId(17L);
		allocation.setClientId(42L);
		allocation.setBankAccountId(3L);
		allocation.setNominalInvested(new BigDecimal("10000"));
		allocation.setStatus(AllocationStatus.ACTIVE);
		allocation.setSource(AllocationSource.BANK_AUTO);
		allocation.setLastSeenInBankFile(DAY_1.minusDays(40));
		when(allocationRepository.findByBankAccountIdAndStatusAndSource(3L, AllocationStatus.ACTIVE, AllocationSource.BANK_AUTO))
				.thenAnswer(invocation -> allocation.getStatus() == AllocationStatus.ACTIVE ? List.of(allocation) : List.of());
		when(allocationRepository.findFirstByProductIdAndClientIdOrderByAllocationIdDesc(17L, 42L))
				.thenReturn(Optional.of(allocation));
		when(allocationRepository.save(any(Allocation.class))).thenAnswer(invocation -> invocation.getArgument(0));

		ImportResultDto result = importServiceWith(new AllocationLinkService(productCatalog, allocationRepository,
				productRepository, holdings.repository(), TestProperties.defaults()))
				.importBatch(batch(DAY_1,
						position("PF-7", "DE0005140008", "EUR", "1000"),
						position("PF-8", "CH0000000017", "EUR", "10000")), "ops");

		assertThat(result.allocationsRedeemed()).isZero();
		assertThat(allocation.getStatus()).isEqualTo(AllocationStatus.ACTIVE);
		assertThat(allocation.getRedeemedAt()).isNull();
		assertThat(allocation.getNotes()).isNull();
		assertThat(allocation.getLastSeenInBankFile()).isEqualTo(DAY_1);
	}

	private PositionImportService importServiceWith(AllocationLinkService linkService) {
		AccountMatcher accountMatcher = new AccountMatcher(bankAccountRepository);
		PositionReconciler reconciler = new PositionReconciler(accountMatcher, holdings.repository(),
				TestProperties.defaults());
		return new PositionImportService(accountMatcher, new PositionEnrichmentService(productCatalog),
				reconciler, linkService, snapshotService, riskMonitorService, holdings.repository(),
				importRunRepository, positionFeed, new TaskExecutorAdapter(Runnable::run), TestProperties.defaults());
	}

	private PositionBatch batch(LocalDate fileDate, BankPosition... positions) {
		String sourceFile = "positions_" + fileDate.toString().replace("-", "") + ".csv";
		return new PositionBatch(BANK, fileDate, sourceFile, List.of(positions));
	}
}
