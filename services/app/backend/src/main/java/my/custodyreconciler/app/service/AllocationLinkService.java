package my.custodyreconciler.app.service;

import my.custodyreconciler.app.config.AppProperties;
import my.custodyreconciler.app.domain.Allocation;
import my.custodyreconciler.app.domain.AllocationSource;
import my.custodyreconciler.app.domain.AllocationStatus;
import my.custodyreconciler.app.domain.BankAccount;
import my.custodyreconciler.app.domain.Holding;
import my.custodyreconciler.app.domain.LinkingStatus;
import my.custodyreconciler.app.domain.Product;
import my.custodyreconciler.app.repository.AllocationRepository;
import my.custodyreconciler.app.repository.HoldingRepository;
import my.custodyreconciler.app.repository.ProductRepository;
import my.custodyreconciler.app.service.util.ISINUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps client allocations of catalog products in step with what the custodian reports: allocations are
 * created on first sight, kept alive while the ISIN keeps appearing and redeemed once it has been missing
 * for longer than the grace window.
 */
@Service
public class AllocationLinkService {
	private static final Logger logger = LoggerFactory.getLogger(AllocationLinkService.class);
	static final BigDecimal DEFAULT_PURCHASE_PRICE = BigDecimal.valueOf(100);
	static final String AUTO_ALLOCATED_BY = "bank_auto";

	private final ProductCatalog productCatalog;
	private final AllocationRepository allocationRepository;
	private final ProductRepository productRepository;
	private final HoldingRepository holdingRepository;
	private final int graceDays;
	// one client's accounts may be reconciled on different threads
	private final Map<Long, ReentrantLock> clientLocks = new ConcurrentHashMap<>();

	public AllocationLinkService(ProductCatalog productCatalog,
								 AllocationRepository allocationRepository,
								 ProductRepository productRepository,
								 HoldingRepository holdingRepository,
								 AppProperties properties) {
		this.productCatalog = productCatalog;
		this.allocationRepository = allocationRepository;
		this.productRepository = productRepository;
		this.holdingRepository = holdingRepository;
		this.graceDays = properties.allocation().redemptionGraceDays();
	}

	public record LinkOutcome(Long productId, Long allocationId, boolean created, boolean reactivated) {
	}

	public Optional<LinkOutcome> link(Holding holding, BankAccount account) {
		if (ISINUtil.normalize(holding.getIsin()) == null || account.getOwnerId() == null) {
			return Optional.empty();
		}
		Optional<ProductClassification> product = productCatalog.lookupByIsin(holding.getIsin());
		if (product.isEmpty()) {
			return Optional.empty();
		}
		Long productId = product.get().productId();
		ReentrantLock lock = clientLocks.computeIfAbsent(account.getOwnerId(), id -> new ReentrantLock());
		lock.lock();
		try {
			LinkOutcome outcome = upsertAllocation(productId, holding, account);
			linkHolding(holding, outcome);
			return Optional.of(outcome);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Redeems the account's automatic allocations whose ISIN none of the client's accounts reports in this file
	 * and that have not been seen for more than the grace window. Allocations without a last-seen date are left
	 * active until a file reports them.
	 *
	 * @param clientIsinsInFile normalized ISINs of every position of the account's owner in the current file
	 */
	public int redeemMissing(BankAccount account, Set<String> clientIsinsInFile, LocalDate fileDate) {
		if (account.getOwnerId() == null) {
			return redeemMissingLocked(account, clientIsinsInFile, fileDate);
		}
		ReentrantLock lock = clientLocks.computeIfAbsent(account.getOwnerId(), id -> new ReentrantLock());
		lock.lock();
		try {
			return redeemMissingLocked(account, clientIsinsInFile, fileDate);
		} finally {
			lock.unlock();
		}
	}

	private int redeemMissingLocked(BankAccount account, Set<String> clientIsinsInFile, LocalDate fileDate) {
		List<Allocation> candidates = allocationRepository.findByBankAccountIdAndStatusAndSource(
				account.getBankAccountId(), AllocationStatus.ACTIVE, AllocationSource.BANK_AUTO);
		if (candidates.isEmpty()) {
			return 0;
		}
		Set<String> isinsInFile = clientIsinsInFile == null ? Set.of() : clientIsinsInFile;
		Map<Long, String> isinByProduct = new HashMap<>();
		for (Product product : productRepository.findAllById(candidates.stream().map(Allocation::getProductId).toList())) {
			isinByProduct.put(product.getProductId(), ISINUtil.normalize(product.getIsin()));
		}
		int redeemed = 0;
		for (Allocation allocation : candidates) {
			String isin = isinByProduct.get(allocation.getProductId());
			if (isin == null) {
				logger.warn("Allocation {} refers to unknown product {}", allocation.getAllocationId(),
						allocation.getProductId());
				continue;
			}
			if (isinsInFile.contains(isin)) {
				continue;
			}
			if (allocation.getLastSeenInBankFile() == null) {
				logger.warn("Allocation {} of client {} has no last-seen date, redemption of {} deferred",
						allocation.getAllocationId(), allocation.getClientId(), isin);
				continue;
			}
			long daysMissing = ChronoUnit.DAYS.between(allocation.getLastSeenInBankFile(), fileDate);
			if (daysMissing <= graceDays) {
				continue;
			}
			allocation.setStatus(AllocationStatus.REDEEMED);
			allocation.setRedeemedAt(fileDate);
			allocation.setRedemptionValue(allocation.getNominalInvested());
			allocationRepository.save(allocation);
			redeemed++;
			logger.info("Allocation {} of client {} redeemed, ISIN {} missing since {}", allocation.getAllocationId(),
					allocation.getClientId(), isin, allocation.getLastSeenInBankFile());
		}
		return redeemed;
	}

	private LinkOutcome upsertAllocation(Long productId, Holding holding, BankAccount account) {
		Optional<Allocation> existing = allocationRepository.findFirstByProductIdAndClientIdOrderByAllocationIdDesc(
				productId, account.getOwnerId());
		if (existing.isEmpty()) {
			Allocation allocation = new Allocation();
			allocation.setProductId(productId);
			allocation.setClientId(account.getOwnerId());
			allocation.setBankAccountId(account.getBankAccountId());
			allocation.setNominalInvested(holding.getMarketValue() == null ? BigDecimal.ZERO : holding.getMarketValue());
			allocation.setPurchasePrice(holding.getCostPrice() == null ? DEFAULT_PURCHASE_PRICE : holding.getCostPrice());
			allocation.setQuantity(holding.getQuantity());
			allocation.setStatus(AllocationStatus.ACTIVE);
			allocation.setSource(AllocationSource.BANK_AUTO);
			allocation.setAllocatedAt(LocalDateTime.now());
			allocation.setAllocatedBy(AUTO_ALLOCATED_BY);
			allocation.setAutoAllocatedFromFile(holding.getSourceFile());
			allocation.setLastSeenInBankFile(holding.getFileDate());
			Allocation saved = allocationRepository.save(allocation);
			logger.info("Created allocation {} of product {} for client {}", saved.getAllocationId(), productId,
					account.getOwnerId());
			return new LinkOutcome(productId, saved.getAllocationId(), true, false);
		}
		Allocation allocation = existing.get();
		allocation.setLastSeenInBankFile(holding.getFileDate());
		boolean reactivated = allocation.getStatus() == AllocationStatus.REDEEMED;
		if (reactivated) {
			allocation.setStatus(AllocationStatus.ACTIVE);
			allocation.setRedeemedAt(null);
			allocation.setRedemptionValue(null);
			allocation.setNotes(appendNote(allocation.getNotes(),
					"Reappeared in bank file " + holding.getSourceFile() + " on " + holding.getFileDate()));
			logger.info("Allocation {} of client {} reactivated", allocation.getAllocationId(), account.getOwnerId());
		}
		Allocation saved = allocationRepository.save(allocation);
		return new LinkOutcome(productId, saved.getAllocationId(), false, reactivated);
	}

	private void linkHolding(Holding holding, LinkOutcome outcome) {
		boolean unchanged = holding.getLinkingStatus() == LinkingStatus.LINKED
				&& Objects.equals(holding.getLinkedProductId(), outcome.productId())
				&& Objects.equals(holding.getLinkedAllocationId(), outcome.allocationId());
		if (unchanged) {
			return;
		}
		holding.setLinkedProductId(outcome.productId());
		holding.setLinkedAllocationId(outcome.allocationId());
		holding.setLinkingStatus(LinkingStatus.LINKED);
		holding.setLinkedAt(LocalDateTime.now());
		holdingRepository.save(holding);
	}

	private String appendNote(String notes, String note) {
		return notes == null || notes.isBlank() ? note : notes + "\n" + note;
	}
}
