package my.custodyreconciler.app.service;

import my.custodyreconciler.app.config.AppProperties;
import my.custodyreconciler.app.domain.BankAccount;
import my.custodyreconciler.app.domain.Holding;
import my.custodyreconciler.app.domain.HoldingStatus;
import my.custodyreconciler.app.domain.LinkingStatus;
import my.custodyreconciler.app.importer.BankPosition;
import my.custodyreconciler.app.importer.PositionBatch;
import my.custodyreconciler.app.repository.HoldingRepository;
import my.custodyreconciler.app.service.util.ISINUtil;
import my.custodyreconciler.app.service.util.UniqueKeyUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Brings stored holdings in line with a custodian batch: new keys are inserted, changed ones updated,
 * unchanged ones only get the new file provenance, and keys missing from the batch are closed as sold.
 */
@Service
public class PositionReconciler {
	private static final Logger logger = LoggerFactory.getLogger(PositionReconciler.class);
	static final String SOLD_REASON = "not_in_bank_file";

	private final AccountMatcher accountMatcher;
	private final HoldingRepository holdingRepository;
	private final boolean versionHistory;

	public PositionReconciler(AccountMatcher accountMatcher, HoldingRepository holdingRepository,
							  AppProperties properties) {
		this.accountMatcher = accountMatcher;
		this.holdingRepository = holdingRepository;
		this.versionHistory = properties.reconciliation().versionHistory();
	}

	public BatchContext reconcile(PositionBatch batch) {
		return reconcile(batch, Map.of());
	}

	/**
	 * @param resolvedAccounts accounts the caller already resolved, keyed by portfolio code; other codes are
	 *                         resolved through the {@link AccountMatcher}
	 */
	public BatchContext reconcile(PositionBatch batch, Map<String, BankAccount> resolvedAccounts) {
		BatchContext context = new BatchContext(batch.bankId(), batch.fileDate(), batch.sourceFile());
		Map<String, Optional<BankAccount>> accounts = new HashMap<>();
		resolvedAccounts.forEach((code, account) -> accounts.put(code, Optional.of(account)));
		for (BankPosition position : batch.positions()) {
			try {
				Optional<BankAccount> account = accounts.computeIfAbsent(position.portfolioCode(),
						code -> accountMatcher.resolve(code, batch.bankId()));
				if (account.isEmpty()) {
					logger.warn("No account for portfolio {} of bank {}, position skipped",
							position.portfolioCode(), batch.bankId());
					context.recordUnmapped(position.portfolioCode());
					continue;
				}
				apply(context, position, account.get());
			} catch (DataAccessResourceFailureException ex) {
				throw ex;
			} catch (RuntimeException ex) {
				logger.warn("Failed to reconcile position {} in portfolio {}: {}", position.isin(),
						position.portfolioCode(), ex.getMessage());
				context.recordError(position.portfolioCode(), position.isin(), ex.getMessage());
			}
		}
		return context;
	}

	/**
	 * Closes every active holding of the touched portfolios whose key the batch did not contain.
	 */
	public int markSold(BatchContext context) {
		int sold = 0;
		LocalDateTime now = LocalDateTime.now();
		for (BatchContext.Portfolio portfolio : context.portfolios()) {
			List<Holding> active = holdingRepository.findByBankIdAndPortfolioCodeAndLatestTrueAndStatus(
					portfolio.bankId(), portfolio.portfolioCode(), HoldingStatus.ACTIVE);
			for (Holding holding : active) {
				if (context.isProcessed(holding.getUniqueKey())) {
					continue;
				}
				holding.setStatus(HoldingStatus.SOLD);
				holding.setSoldAt(context.fileDate());
				holding.setSoldReason(SOLD_REASON);
				holding.setUpdatedAt(now);
				holdingRepository.save(holding);
				sold++;
			}
		}
		if (sold > 0) {
			logger.info("Marked {} holdings of bank {} as sold", sold, context.bankId());
		}
		context.addSold(sold);
		return sold;
	}

	private void apply(BatchContext context, BankPosition position, BankAccount account) {
		String key = UniqueKeyUtil.key(context.bankId(), position.portfolioCode(), position.isin(),
				position.positionNumber(), position.instrumentCode(), position.currency());
		LocalDateTime now = LocalDateTime.now();
		Optional<Holding> existing = holdingRepository.findFirstByUniqueKeyAndLatestTrue(key);
		if (existing.isEmpty()) {
			Holding holding = new Holding();
			holding.setUniqueKey(key);
			holding.setVersion(1);
			holding.setLatest(true);
			holding.setLinkingStatus(LinkingStatus.UNLINKED);
			holding.setCreatedAt(now);
			applyPosition(holding, position, account, context, now);
			context.recordCreated(holdingRepository.save(holding));
			return;
		}
		Holding current = existing.get();
		if (!hasChanged(current, position, context.fileDate())) {
			current.setFileDate(context.fileDate());
			current.setSourceFile(context.sourceFile());
			context.recordUnchanged(holdingRepository.save(current));
			return;
		}
		if (versionHistory) {
			Holding next = nextVersion(current, now);
			applyPosition(next, position, account, context, now);
			Holding saved = holdingRepository.save(next);
			current.setLatest(false);
			current.setStatus(HoldingStatus.SUPERSEDED);
			current.setUpdatedAt(now);
			holdingRepository.save(current);
			context.recordUpdated(saved);
			return;
		}
		applyPosition(current, position, account, context, now);
		context.recordUpdated(holdingRepository.save(current));
	}

	private void applyPosition(Holding holding, BankPosition position, BankAccount account, BatchContext context,
							   LocalDateTime now) {
		holding.setBankId(context.bankId());
		holding.setPortfolioCode(position.portfolioCode());
		holding.setAccountNumber(position.accountNumber() == null ? account.getAccountNumber() : position.accountNumber());
		holding.setOwnerId(account.getOwnerId());
		holding.setBankAccountId(account.getBankAccountId());
		holding.setIsin(ISINUtil.normalize(position.isin()));
		holding.setPositionNumber(position.positionNumber());
		holding.setInstrumentCode(position.instrumentCode());
		holding.setSecurityName(position.securityName());
		holding.setAssetClass(position.assetClass());
		holding.setSecurityType(position.securityType());
		holding.setCurrency(position.currency());
		holding.setQuantity(position.quantity());
		holding.setMarketPrice(position.marketPrice());
		holding.setMarketValue(position.marketValue());
		holding.setCostPrice(position.costPrice());
		holding.setSnapshotDate(snapshotDate(position, context.fileDate()));
		holding.setFileDate(context.fileDate());
		holding.setSourceFile(context.sourceFile());
		holding.setBankSpecificData(new LinkedHashMap<>(position.bankSpecificData()));
		holding.setStatus(HoldingStatus.ACTIVE);
		holding.setSoldAt(null);
		holding.setSoldReason(null);
		holding.setUpdatedAt(now);
	}

	private Holding nextVersion(Holding current, LocalDateTime now) {
		Holding next = new Holding();
		next.setUniqueKey(current.getUniqueKey());
		next.setVersion(current.getVersion() + 1);
		next.setLatest(true);
		next.setCreatedAt(now);
		next.setLinkedProductId(current.getLinkedProductId());
		next.setLinkedAllocationId(current.getLinkedAllocationId());
		next.setLinkingStatus(current.getLinkingStatus());
		next.setLinkedAt(current.getLinkedAt());
		return next;
	}

	static boolean hasChanged(Holding current, BankPosition position, LocalDate fileDate) {
		return !Objects.equals(current.getSnapshotDate(), snapshotDate(position, fileDate))
				|| !sameAmount(current.getQuantity(), position.quantity())
				|| !sameAmount(current.getMarketValue(), position.marketValue())
				|| !sameAmount(current.getMarketPrice(), position.marketPrice())
				|| !sameAmount(current.getCostPrice(), position.costPrice())
				|| !Objects.equals(current.getCurrency(), position.currency())
				|| !Objects.equals(current.getSecurityName(), position.securityName())
				|| !Objects.equals(current.getAssetClass(), position.assetClass())
				|| !Objects.equals(current.getSecurityType(), position.securityType())
				|| !sameData(current.getBankSpecificData(), position.bankSpecificData())
				|| current.getStatus() != HoldingStatus.ACTIVE;
	}

	/**
	 * Compares custodian and classification data, ignoring the enrichment timestamp. Numbers are compared by
	 * value since a JSON round trip may change their type.
	 */
	static boolean sameData(Map<String, Object> stored, Map<String, Object> incoming) {
		Map<String, Object> left = stored == null ? Map.of() : stored;
		Map<String, Object> right = incoming == null ? Map.of() : incoming;
		Set<String> keys = new HashSet<>(left.keySet());
		keys.addAll(right.keySet());
		keys.remove(PositionEnrichmentService.ENRICHED_AT);
		for (String key : keys) {
			if (left.containsKey(key) != right.containsKey(key) || !sameValue(left.get(key), right.get(key))) {
				return false;
			}
		}
		return true;
	}

	private static boolean sameValue(Object left, Object right) {
		if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
			return new BigDecimal(leftNumber.toString()).compareTo(new BigDecimal(rightNumber.toString())) == 0;
		}
		return Objects.equals(left, right);
	}

	private static LocalDate snapshotDate(BankPosition position, LocalDate fileDate) {
		return position.snapshotDate() == null ? fileDate : position.snapshotDate();
	}

	private static boolean sameAmount(BigDecimal left, BigDecimal right) {
		if (left == null || right == null) {
			return left == right;
		}
		return left.compareTo(right) == 0;
	}
}
