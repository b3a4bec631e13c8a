package my.custodyreconciler.app.service;

import my.custodyreconciler.app.config.AppProperties;
import my.custodyreconciler.app.domain.BankAccount;
import my.custodyreconciler.app.domain.Holding;
import my.custodyreconciler.app.domain.HoldingStatus;
import my.custodyreconciler.app.domain.ImportRun;
import my.custodyreconciler.app.domain.ImportRunStatus;
import my.custodyreconciler.app.domain.PortfolioSnapshot;
import my.custodyreconciler.app.dto.ImportErrorDto;
import my.custodyreconciler.app.dto.ImportResultDto;
import my.custodyreconciler.app.dto.ImportRunDto;
import my.custodyreconciler.app.importer.BankPosition;
import my.custodyreconciler.app.importer.FeedUnavailableException;
import my.custodyreconciler.app.importer.PositionBatch;
import my.custodyreconciler.app.importer.PositionFeed;
import my.custodyreconciler.app.repository.HoldingRepository;
import my.custodyreconciler.app.repository.ImportRunRepository;
import my.custodyreconciler.app.service.util.ISINUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a custodian batch through matching, reconciliation, allocation linking, snapshots and risk checks.
 * Batches of one bank are applied one at a time; account groups inside a batch run in parallel.
 */
@Service
public class PositionImportService {
	private static final Logger logger = LoggerFactory.getLogger(PositionImportService.class);
	static final String OUT_OF_ORDER = "out_of_order_batch";
	static final String DEFAULT_ACTOR = "system";

	private final AccountMatcher accountMatcher;
	private final PositionEnrichmentService enrichmentService;
	private final PositionReconciler reconciler;
	private final AllocationLinkService allocationLinkService;
	private final PortfolioSnapshotService snapshotService;
	private final RiskMonitorService riskMonitorService;
	private final HoldingRepository holdingRepository;
	private final ImportRunRepository importRunRepository;
	private final PositionFeed positionFeed;
	private final AsyncTaskExecutor reconciliationExecutor;
	private final Duration batchTimeout;
	private final Map<String, ReentrantLock> bankLocks = new ConcurrentHashMap<>();

	public PositionImportService(AccountMatcher accountMatcher,
								 PositionEnrichmentService enrichmentService,
								 PositionReconciler reconciler,
								 AllocationLinkService allocationLinkService,
								 PortfolioSnapshotService snapshotService,
								 RiskMonitorService riskMonitorService,
								 HoldingRepository holdingRepository,
								 ImportRunRepository importRunRepository,
								 PositionFeed positionFeed,
								 @Qualifier("reconciliationExecutor") AsyncTaskExecutor reconciliationExecutor,
								 AppProperties properties) {
		this.accountMatcher = accountMatcher;
		this.enrichmentService = enrichmentService;
		this.reconciler = reconciler;
		this.allocationLinkService = allocationLinkService;
		this.snapshotService = snapshotService;
		this.riskMonitorService = riskMonitorService;
		this.holdingRepository = holdingRepository;
		this.importRunRepository = importRunRepository;
		this.positionFeed = positionFeed;
		this.reconciliationExecutor = reconciliationExecutor;
		this.batchTimeout = properties.pipeline().batchTimeout();
	}

	public ImportResultDto importLatestFromFeed(String bankId, String triggeredBy) {
		if (bankId == null || bankId.isBlank()) {
			throw new IllegalArgumentException("bankId is required");
		}
		PositionBatch batch;
		try {
			batch = positionFeed.readLatest(bankId);
		} catch (FeedUnavailableException ex) {
			recordFailedRun(bankId, null, LocalDate.now(), actor(triggeredBy), ex.getMessage());
			throw ex;
		}
		return importBatch(batch, triggeredBy);
	}

	/**
	 * Imports the newest feed file unless a completed run already applied it.
	 */
	public Optional<ImportResultDto> importNewFromFeed(String bankId, String triggeredBy) {
		PositionBatch batch = positionFeed.readLatest(bankId);
		if (importRunRepository.existsByBankIdAndSourceFileAndStatusIn(bankId, batch.sourceFile(),
				List.of(ImportRunStatus.COMPLETED, ImportRunStatus.COMPLETED_WITH_ISSUES))) {
			logger.debug("File {} of bank {} already imported", batch.sourceFile(), bankId);
			return Optional.empty();
		}
		return Optional.of(importBatch(batch, triggeredBy));
	}

	public ImportResultDto importBatch(PositionBatch batch, String triggeredBy) {
		validateBoundary(batch);
		ReentrantLock lock = bankLocks.computeIfAbsent(batch.bankId(), id -> new ReentrantLock());
		lock.lock();
		try {
			return runLocked(batch, actor(triggeredBy));
		} finally {
			lock.unlock();
		}
	}

	public List<ImportRunDto> listRuns(String bankId) {
		List<ImportRun> runs = bankId == null || bankId.isBlank()
				? importRunRepository.findTop50ByOrderByStartedAtDesc()
				: importRunRepository.findTop50ByBankIdOrderByStartedAtDesc(bankId);
		return runs.stream().map(this::toDto).toList();
	}

	private void validateBoundary(PositionBatch batch) {
		if (batch == null) {
			throw new IllegalArgumentException("batch is required");
		}
		if (batch.bankId() == null || batch.bankId().isBlank()) {
			throw new IllegalArgumentException("bankId is required");
		}
		if (batch.fileDate() == null) {
			throw new IllegalArgumentException("fileDate is required");
		}
		if (batch.isEmpty()) {
			throw new IllegalArgumentException("batch contains no positions");
		}
	}

	private ImportResultDto runLocked(PositionBatch batch, String actor) {
		ImportRun run = startRun(batch, actor);
		logger.info("Import run {} started for bank {} file {} ({} positions) by {}", run.getRunId(), batch.bankId(),
				batch.sourceFile(), batch.positions().size(), actor);
		ImportTally tally = new ImportTally();
		try {
			List<BankPosition> valid = validatePositions(batch, tally);
			Map<Long, AccountGroup> groups = groupByAccount(batch.bankId(), valid, tally);
			Map<Long, Set<String>> isinsByClient = isinsByClient(groups.values());
			runGroups(batch, actor, groups.values(), isinsByClient, tally);
		} catch (ImportPipelineException ex) {
			failRun(run, tally, ex.getMessage());
			throw ex;
		} catch (DataAccessResourceFailureException ex) {
			failRun(run, tally, ex.getMessage());
			throw new ImportPipelineException("Storage unavailable, batch incomplete, safe to retry", ex);
		} catch (RuntimeException ex) {
			failRun(run, tally, ex.getMessage());
			throw ex;
		}
		ImportRunStatus status = tally.hasIssues() ? ImportRunStatus.COMPLETED_WITH_ISSUES : ImportRunStatus.COMPLETED;
		finishRun(run, tally, status, null);
		logger.info("Import run {} {}: {} created, {} updated, {} unchanged, {} skipped, {} sold, unmapped {}",
				run.getRunId(), status, tally.created, tally.updated, tally.unchanged, tally.skipped, tally.sold,
				tally.unmappedCodes);
		return new ImportResultDto(run.getRunId(), batch.bankId(), batch.fileDate(), batch.sourceFile(), status.name(),
				batch.positions().size(), tally.created, tally.updated, tally.unchanged, tally.skipped, tally.sold,
				tally.redeemed, tally.snapshots, List.copyOf(tally.unmappedCodes), List.copyOf(tally.errors));
	}

	private List<BankPosition> validatePositions(PositionBatch batch, ImportTally tally) {
		List<BankPosition> valid = new ArrayList<>();
		for (BankPosition position : batch.positions()) {
			Optional<String> problem = position.validationProblem();
			if (problem.isEmpty() && position.bankId() != null && !position.bankId().equals(batch.bankId())) {
				problem = Optional.of("position belongs to bank " + position.bankId());
			}
			if (problem.isPresent()) {
				tally.skip(new ImportErrorDto(position.portfolioCode(), position.isin(), problem.get()));
				continue;
			}
			valid.add(position.snapshotDate() == null ? position.withSnapshotDate(batch.fileDate()) : position);
		}
		return valid;
	}

	private Map<Long, AccountGroup> groupByAccount(String bankId, List<BankPosition> positions, ImportTally tally) {
		Map<String, Optional<BankAccount>> byCode = new HashMap<>();
		Map<Long, AccountGroup> groups = new LinkedHashMap<>();
		for (BankPosition position : positions) {
			Optional<BankAccount> account = byCode.computeIfAbsent(position.portfolioCode(),
					code -> accountMatcher.resolve(code, bankId));
			if (account.isEmpty()) {
				tally.unmapped(position.portfolioCode());
				continue;
			}
			groups.computeIfAbsent(account.get().getBankAccountId(), id -> new AccountGroup(account.get()))
					.add(position);
		}
		if (!tally.unmappedCodes.isEmpty()) {
			logger.warn("Bank {} has unmapped portfolio codes {}", bankId, tally.unmappedCodes);
		}
		return groups;
	}

	/**
	 * ISINs of the whole file per client. A client's product counts as present when any of the client's
	 * accounts in this file reports it.
	 */
	private Map<Long, Set<String>> isinsByClient(Iterable<AccountGroup> groups) {
		Map<Long, Set<String>> isins = new HashMap<>();
		for (AccountGroup group : groups) {
			Set<String> clientIsins = isins.computeIfAbsent(clientKey(group.account), id -> new HashSet<>());
			group.positions.stream().map(position -> ISINUtil.normalize(position.isin())).filter(Objects::nonNull)
					.forEach(clientIsins::add);
		}
		return isins;
	}

	// accounts without an owner are keyed by their negated id so they never share a client set
	private Long clientKey(BankAccount account) {
		return account.getOwnerId() != null ? account.getOwnerId() : -account.getBankAccountId();
	}

	private void runGroups(PositionBatch batch, String actor, Iterable<AccountGroup> groups,
						   Map<Long, Set<String>> isinsByClient, ImportTally tally) {
		List<Future<?>> futures = new ArrayList<>();
		List<AccountGroup> submitted = new ArrayList<>();
		for (AccountGroup group : groups) {
			futures.add(reconciliationExecutor.submit(() -> processGroup(batch, actor, group, isinsByClient.get(clientKey(group.account)), tally)));
			submitted.add(group);
		}
		long deadline = System.nanoTime() + batchTimeout.toNanos();
		for (int i = 0; i < futures.size(); i++) {
			Future<?> future = futures.get(i);
			try {
				future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
			} catch (TimeoutException ex) {
				futures.forEach(pending -> pending.cancel(true));
				throw new ImportPipelineException("Batch for bank " + batch.bankId() + " did not finish within "
						+ batchTimeout + ", batch incomplete, safe to retry", ex);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				futures.forEach(pending -> pending.cancel(true));
				throw new ImportPipelineException("Import interrupted, batch incomplete, safe to retry", ex);
			} catch (ExecutionException ex) {
				Throwable cause = ex.getCause();
				if (cause instanceof DataAccessResourceFailureException storageFailure) {
					futures.forEach(pending -> pending.cancel(true));
					throw storageFailure;
				}
				AccountGroup group = submitted.get(i);
				logger.error("Account group {} of bank {} failed", group.account.getAccountNumber(), batch.bankId(), cause);
				tally.issue(new ImportErrorDto(group.account.getAccountNumber(), null,
						"account_group_failed: " + (cause == null ? ex.getMessage() : cause.getMessage())));
			}
		}
	}

	private void processGroup(PositionBatch batch, String actor, AccountGroup group, Set<String> clientIsinsInFile,
							  ImportTally tally) {
		BankAccount account = group.account;
		List<BankPosition> accepted = new ArrayList<>();
		for (Map.Entry<String, List<BankPosition>> entry : group.byPortfolio().entrySet()) {
			LocalDate newest = holdingRepository.findMaxFileDate(batch.bankId(), entry.getKey());
			if (newest != null && batch.fileDate().isBefore(newest)) {
				logger.warn("Skipping portfolio {} of bank {}: file date {} is older than stored {}", entry.getKey(),
						batch.bankId(), batch.fileDate(), newest);
				for (BankPosition position : entry.getValue()) {
					tally.skip(new ImportErrorDto(entry.getKey(), position.isin(),
							OUT_OF_ORDER + ": file date " + batch.fileDate() + " is older than " + newest));
				}
				continue;
			}
			accepted.addAll(entry.getValue());
		}
		if (accepted.isEmpty()) {
			return;
		}

		List<BankPosition> enriched = accepted.stream().map(enrichmentService::enrich).toList();
		Map<String, BankAccount> resolved = new HashMap<>();
		enriched.forEach(position -> resolved.put(position.portfolioCode(), account));
		BatchContext context = reconciler.reconcile(batch.withPositions(enriched), resolved);
		reconciler.markSold(context);

		for (Holding holding : context.touchedHoldings()) {
			if (holding.getIsin() == null) {
				continue;
			}
			try {
				allocationLinkService.link(holding, account);
			} catch (DataAccessResourceFailureException ex) {
				throw ex;
			} catch (RuntimeException ex) {
				logger.warn("Linking holding {} of portfolio {} failed: {}", holding.getIsin(),
						holding.getPortfolioCode(), ex.getMessage());
				context.recordIssue(holding.getPortfolioCode(), holding.getIsin(), "linking_failed: " + ex.getMessage());
			}
		}
		int redeemed = allocationLinkService.redeemMissing(account, clientIsinsInFile, batch.fileDate());

		int snapshots = 0;
		for (BatchContext.Portfolio portfolio : context.portfolios()) {
			List<Holding> holdings = holdingRepository.findByBankIdAndPortfolioCodeAndLatestTrueAndStatus(
					portfolio.bankId(), portfolio.portfolioCode(), HoldingStatus.ACTIVE);
			PortfolioSnapshot snapshot = null;
			try {
				snapshot = snapshotService.snapshot(portfolio.ownerId(), portfolio.bankId(), portfolio.portfolioCode(),
						holdings, snapshotDate(holdings, batch.fileDate()));
				snapshots++;
			} catch (DataAccessResourceFailureException ex) {
				throw ex;
			} catch (RuntimeException ex) {
				logger.error("Snapshot of portfolio {} failed", portfolio.portfolioCode(), ex);
				context.recordIssue(portfolio.portfolioCode(), null, "snapshot_failed: " + ex.getMessage());
			}
			try {
				riskMonitorService.evaluate(new RiskMonitorService.PortfolioScope(account, portfolio.bankId(),
						portfolio.portfolioCode(), actor), holdings, snapshot);
			} catch (DataAccessResourceFailureException ex) {
				throw ex;
			} catch (RuntimeException ex) {
				logger.error("Risk evaluation of portfolio {} failed", portfolio.portfolioCode(), ex);
				context.recordIssue(portfolio.portfolioCode(), null, "risk_check_failed: " + ex.getMessage());
			}
		}
		tally.merge(context, redeemed, snapshots);
	}

	private LocalDate snapshotDate(List<Holding> holdings, LocalDate fileDate) {
		return holdings.stream()
				.filter(holding -> fileDate.equals(holding.getFileDate()))
				.map(Holding::getSnapshotDate)
				.filter(Objects::nonNull)
				.max(LocalDate::compareTo)
				.orElse(fileDate);
	}

	private ImportRun startRun(PositionBatch batch, String actor) {
		ImportRun run = new ImportRun();
		run.setBankId(batch.bankId());
		run.setSourceFile(batch.sourceFile());
		run.setFileDate(batch.fileDate());
		run.setTriggeredBy(actor);
		run.setStatus(ImportRunStatus.STARTED);
		run.setTotalRecords(batch.positions().size());
		run.setStartedAt(LocalDateTime.now());
		return importRunRepository.save(run);
	}

	private void finishRun(ImportRun run, ImportTally tally, ImportRunStatus status, String failureMessage) {
		run.setStatus(status);
		run.setCreatedCount(tally.created);
		run.setUpdatedCount(tally.updated);
		run.setUnchangedCount(tally.unchanged);
		run.setSkippedCount(tally.skipped);
		run.setSoldCount(tally.sold);
		run.setUnmappedCodes(new ArrayList<>(tally.unmappedCodes));
		List<Map<String, String>> errors = new ArrayList<>();
		for (ImportErrorDto error : tally.errors) {
			Map<String, String> entry = new LinkedHashMap<>();
			entry.put("portfolioCode", error.portfolioCode());
			entry.put("isin", error.isin());
			entry.put("error", error.error());
			errors.add(entry);
		}
		run.setErrors(errors);
		run.setFinishedAt(LocalDateTime.now());
		run.setFailureMessage(failureMessage);
		importRunRepository.save(run);
	}

	private void failRun(ImportRun run, ImportTally tally, String message) {
		logger.error("Import run {} for bank {} failed: {}", run.getRunId(), run.getBankId(), message);
		try {
			finishRun(run, tally, ImportRunStatus.FAILED, message);
		} catch (RuntimeException ex) {
			logger.error("Could not record failure of import run {}", run.getRunId(), ex);
		}
	}

	private void recordFailedRun(String bankId, String sourceFile, LocalDate fileDate, String actor, String message) {
		ImportRun run = new ImportRun();
		run.setBankId(bankId);
		run.setSourceFile(sourceFile);
		run.setFileDate(fileDate);
		run.setTriggeredBy(actor);
		run.setStatus(ImportRunStatus.FAILED);
		run.setStartedAt(LocalDateTime.now());
		run.setFinishedAt(LocalDateTime.now());
		run.setFailureMessage(message);
		importRunRepository.save(run);
	}

	private String actor(String triggeredBy) {
		return triggeredBy == null || triggeredBy.isBlank() ? DEFAULT_ACTOR : triggeredBy;
	}

	private ImportRunDto toDto(ImportRun run) {
		return new ImportRunDto(
				run.getRunId(),
				run.getBankId(),
				run.getSourceFile(),
				run.getFileDate(),
				run.getTriggeredBy(),
				run.getStatus().name(),
				run.getTotalRecords(),
				run.getCreatedCount(),
				run.getUpdatedCount(),
				run.getUnchangedCount(),
				run.getSkippedCount(),
				run.getSoldCount(),
				run.getUnmappedCodes(),
				run.getErrors() == null ? 0 : run.getErrors().size(),
				run.getStartedAt(),
				run.getFinishedAt(),
				run.getFailureMessage()
		);
	}

	private static final class AccountGroup {
		private final BankAccount account;
		private final List<BankPosition> positions = new ArrayList<>();

		private AccountGroup(BankAccount account) {
			this.account = account;
		}

		private void add(BankPosition position) {
			positions.add(position);
		}

		private Map<String, List<BankPosition>> byPortfolio() {
			Map<String, List<BankPosition>> byPortfolio = new LinkedHashMap<>();
			for (BankPosition position : positions) {
				byPortfolio.computeIfAbsent(position.portfolioCode(), code -> new ArrayList<>()).add(position);
			}
			return byPortfolio;
		}
	}

	/**
	 * Run totals; account groups report into it from executor threads.
	 */
	private static final class ImportTally {
		private int created;
		private int updated;
		private int unchanged;
		private int skipped;
		private int sold;
		private int redeemed;
		private int snapshots;
		private final Set<String> unmappedCodes = new LinkedHashSet<>();
		private final List<ImportErrorDto> errors = new ArrayList<>();

		synchronized void skip(ImportErrorDto error) {
			skipped++;
			errors.add(error);
		}

		synchronized void issue(ImportErrorDto error) {
			errors.add(error);
		}

		synchronized void unmapped(String portfolioCode) {
			skipped++;
			unmappedCodes.add(portfolioCode);
		}

		synchronized void merge(BatchContext context, int redeemedCount, int snapshotCount) {
			created += context.created();
			updated += context.updated();
			unchanged += context.unchanged();
			skipped += context.skipped();
			sold += context.sold();
			redeemed += redeemedCount;
			snapshots += snapshotCount;
			unmappedCodes.addAll(context.unmappedCodes());
			errors.addAll(context.errors());
		}

		synchronized boolean hasIssues() {
			return skipped > 0 || !errors.isEmpty() || !unmappedCodes.isEmpty();
		}
	}
}
