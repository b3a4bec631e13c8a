package my.custodyreconciler.app.service;

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
import my.custodyreconciler.app.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static my.custodyreconciler.app.support.TestPositions.FILE_DATE;
import static my.custodyreconciler.app.support.TestPositions.account;
import static my.custodyreconciler.app.support.TestPositions.holding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AllocationLinkServiceTest {
	private static final String ISIN = "CH1234567890";

	@Mock
	private ProductCatalog productCatalog;

	@Mock
	private AllocationRepository allocationRepository;

	@Mock
	private ProductRepository productRepository;

	@Mock
	private HoldingRepository holdingRepository;

	private AllocationLinkService linkService;
	private final BankAccount account = account(3L, "PF-7", 42L);

	@BeforeEach
	void setUp() {
		linkService = new AllocationLinkService(productCatalog, allocationRepository, productRepository,
				holdingRepository, TestProperties.defaults());
	}

	@Test
	void firstSightingCreatesAutomaticAllocation() {
		Holding holding = holding("PF-7", ISIN, "structured_product", "EUR", "50000");
		when(productCatalog.lookupByIsin(ISIN)).thenReturn(Optional.of(classification(5L)));
		when(allocationRepository.findFirstByProductIdAndClientIdOrderByAllocationIdDesc(5L, 42L))
				.thenReturn(Optional.empty());
		when(allocationRepository.save(any(Allocation.class))).thenAnswer(invocation -> {
			Allocation allocation = invocation.getArgument(0);
			allocation.setAllocationId(900L);
			return allocation;
		});

		AllocationLinkService.LinkOutcome outcome = linkService.link(holding, account).orElseThrow();

		assertThat(outcome.created()).isTrue();
		assertThat(outcome.allocationId()).isEqualTo(900L);
		ArgumentCaptor<Allocation> captor = ArgumentCaptor.forClass(Allocation.class);
		verify(allocationRepository).save(captor.capture());
		Allocation allocation = captor.getValue();
		assertThat(allocation.getStatus()).isEqualTo(AllocationStatus.ACTIVE);
		assertThat(allocation.getSource()).isEqualTo(AllocationSource.BANK_AUTO);
		assertThat(allocation.getAllocatedBy()).isEqualTo(AllocationLinkService.AUTO_ALLOCATED_BY);
		assertThat(allocation.getNominalInvested()).isEqualByComparingTo("50000");
		assertThat(allocation.getPurchasePrice()).isEqualByComparingTo(AllocationLinkService.DEFAULT_PURCHASE_PRICE);
		assertThat(allocation.getLastSeenInBankFile()).isEqualTo(FILE_DATE);
		assertThat(allocation.getAutoAllocatedFromFile()).isEqualTo("positions_20250314.csv");
		assertThat(holding.getLinkingStatus()).isEqualTo(LinkingStatus.LINKED);
		assertThat(holding.getLinkedProductId()).isEqualTo(5L);
		assertThat(holding.getLinkedAllocationId()).isEqualTo(900L);
		verify(holdingRepository).save(holding);
	}

	@Test
	void redeemedAllocationIsReactivatedWhenIsinReappears() {
		Holding holding = holding("PF-7", ISIN, "structured_product", "EUR", "50000");
		Allocation redeemed = allocation(77L, 5L, LocalDate.of(2024, 12, 1));
		redeemed.setStatus(AllocationStatus.REDEEMED);
		redeemed.setRedeemedAt(LocalDate.of(2025, 1, 10));
		redeemed.setRedemptionValue(new BigDecimal("48000"));
		when(productCatalog.lookupByIsin(ISIN)).thenReturn(Optional.of(classification(5L)));
		when(allocationRepository.findFirstByProductIdAndClientIdOrderByAllocationIdDesc(5L, 42L))
				.thenReturn(Optional.of(redeemed));
		when(allocationRepository.save(redeemed)).thenReturn(redeemed);

		AllocationLinkService.LinkOutcome outcome = linkService.link(holding, account).orElseThrow();

		assertThat(outcome.reactivated()).isTrue();
		assertThat(outcome.created()).isFalse();
		assertThat(redeemed.getStatus()).isEqualTo(AllocationStatus.ACTIVE);
		assertThat(redeemed.getRedeemedAt()).isNull();
		assertThat(redeemed.getRedemptionValue()).isNull();
		assertThat(redeemed.getLastSeenInBankFile()).isEqualTo(FILE_DATE);
		assertThat(redeemed.getNotes()).contains("Reappeared in bank file positions_20250314.csv");
	}

	@Test
	void alreadyLinkedHoldingIsNotSavedAgain() {
		Holding holding = holding("PF-7", ISIN, "structured_product", "EUR", "50000");
		holding.setLinkingStatus(LinkingStatus.LINKED);
		holding.setLinkedProductId(5L);
		holding.setLinkedAllocationId(77L);
		Allocation active = allocation(77L, 5L, FILE_DATE.minusDays(1));
		when(productCatalog.lookupByIsin(ISIN)).thenReturn(Optional.of(classification(5L)));
		when(allocationRepository.findFirstByProductIdAndClientIdOrderByAllocationIdDesc(5L, 42L))
				.thenReturn(Optional.of(active));
		when(allocationRepository.save(active)).thenReturn(active);

		AllocationLinkService.LinkOutcome outcome = linkService.link(holding, account).orElseThrow();

		assertThat(outcome.reactivated()).isFalse();
		assertThat(active.getLastSeenInBankFile()).isEqualTo(FILE_DATE);
		verify(holdingRepository, never()).save(any());
	}

	@Test
	void holdingsOutsideCatalogAreNotLinked() {
		Holding holding = holding("PF-7", "DE0005140008", "equity", "EUR", "1000");
		when(productCatalog.lookupByIsin("DE0005140008")).thenReturn(Optional.empty());

		assertThat(linkService.link(holding, account)).isEmpty();
		verifyNoInteractions(allocationRepository, holdingRepository);
	}

	@Test
	void allocationsMissingLongerThanGraceAreRedeemed() {
		Allocation seenToday = allocation(1L, 11L, FILE_DATE);
		Allocation seenTenDaysAgo = allocation(2L, 12L, FILE_DATE.minusDays(10));
		Allocation seenThirtyDaysAgo = allocation(3L, 13L, FILE_DATE.minusDays(30));
		Allocation seen31DaysAgo = allocation(4L, 14L, FILE_DATE.minusDays(31));
		Allocation seen40DaysAgo = allocation(5L, 15L, FILE_DATE.minusDays(40));
		Allocation neverSeen = allocation(6L, 16L, null);
		Allocation stillInFile = allocation(7L, 17L, FILE_DATE.minusDays(90));
		List<Allocation> candidates = List.of(seenToday, seenTenDaysAgo, seenThirtyDaysAgo, seen31DaysAgo,
				seen40DaysAgo, neverSeen, stillInFile);
		when(allocationRepository.findByBankAccountIdAndStatusAndSource(3L, AllocationStatus.ACTIVE, AllocationSource.BANK_AUTO))
				.thenReturn(candidates);
		List<Product> products = new ArrayList<>();
		for (Allocation allocation : candidates) {
			products.add(product(allocation.getProductId(), "CH00000000" + allocation.getProductId()));
		}
		when(productRepository.findAllById(any())).thenReturn(products);

		int redeemed = linkService.redeemMissing(account, Set.of("CH0000000017"), FILE_DATE);

		assertThat(redeemed).isEqualTo(2);
		assertThat(seenToday.getStatus()).isEqualTo(AllocationStatus.ACTIVE);
		assertThat(seenTenDaysAgo.getStatus()).isEqualTo(AllocationStatus.ACTIVE);
		assertThat(seenThirtyDaysAgo.getStatus()).isEqualTo(AllocationStatus.ACTIVE);
		assertThat(stillInFile.getStatus()).isEqualTo(AllocationStatus.ACTIVE);
		assertThat(neverSeen.getStatus()).isEqualTo(AllocationStatus.ACTIVE);
		assertThat(List.of(seen31DaysAgo, seen40DaysAgo)).allSatisfy(allocation -> {
			assertThat(allocation.getStatus()).isEqualTo(AllocationStatus.REDEEMED);
			assertThat(allocation.getRedeemedAt()).isEqualTo(FILE_DATE);
			assertThat(allocation.getRedemptionValue()).isEqualByComparingTo("10000");
		});
		verify(allocationRepository).save(seen31DaysAgo);
		verify(allocationRepository, never()).save(seenTenDaysAgo);
		verify(allocationRepository, never()).save(neverSeen);
	}

	@Test
	void nothingToRedeemWithoutAutomaticAllocations() {
		when(allocationRepository.findByBankAccountIdAndStatusAndSource(3L, AllocationStatus.ACTIVE, AllocationSource.BANK_AUTO))
				.thenReturn(List.of());

		assertThat(linkService.redeemMissing(account, Set.of(), FILE_DATE)).isZero();
		verifyNoInteractions(productRepository);
	}

	private ProductClassification classification(Long productId) {
		return new ProductClassification(productId, ISIN, "Phoenix on SMI 2027", "Phoenix Autocallable",
				"structured_product", "Vontobel", "equity_linked", "capital_protected_conditional", false, false, true);
	}

	private Allocation allocation(Long allocationId, Long productId, LocalDate lastSeen) {
		Allocation allocation = new Allocation();
		allocation.setAllocationId(allocationId);
		allocation.setProductId(productId);
		allocation.setClientId(42L);
		allocation.setBankAccountId(3L);
		allocation.setNominalInvested(new BigDecimal("10000"));
		allocation.setPurchasePrice(new BigDecimal("100"));
		allocation.setStatus(AllocationStatus.ACTIVE);
		allocation.setSource(AllocationSource.BANK_AUTO);
		allocation.setLastSeenInBankFile(lastSeen);
		return allocation;
	}

	private Product product(Long productId, String isin) {
		Product product = new Product();
		product.setProductId(productId);
		product.setIsin(isin);
		product.setTitle("Product " + productId);
		return product;
	}
}
