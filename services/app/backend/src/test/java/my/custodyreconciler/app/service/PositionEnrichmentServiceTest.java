package my.custodyreconciler.app.service;

import my.custodyreconciler.app.importer.BankPosition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.Optional;

import static my.custodyreconciler.app.support.TestPositions.cash;
import static my.custodyreconciler.app.support.TestPositions.position;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PositionEnrichmentServiceTest {
	@Mock
	private ProductCatalog productCatalog;

	@InjectMocks
	private PositionEnrichmentService enrichmentService;

	@Test
	void catalogProductOverridesNameAndClass() {
		BankPosition position = position("PF-7", "CH1234567890", "EUR", "1000");
		when(productCatalog.lookupByIsin("CH1234567890")).thenReturn(Optional.of(new ProductClassification(
				5L, "CH1234567890", "Phoenix on SMI 2027", "Phoenix Autocallable", "structured_product", "Vontobel",
				"equity_linked", "capital_protected_conditional", false, false, true)));

		BankPosition enriched = enrichmentService.enrich(position);

		assertThat(enriched.securityName()).isEqualTo("Phoenix on SMI 2027");
		assertThat(enriched.assetClass()).isEqualTo("structured_product");
		assertThat(enriched.bankSpecificData())
				.containsEntry("productId", 5L)
				.containsEntry("productType", "Phoenix Autocallable")
				.containsEntry("barrierProtected", true)
				.containsEntry("autoEnriched", true)
				.containsKey("enrichedAt");
		assertThat(enriched.marketValue()).isEqualByComparingTo(position.marketValue());
	}

	@Test
	void unknownIsinPassesThrough() {
		BankPosition position = position("PF-7", "DE0005140008", "EUR", "1000");
		when(productCatalog.lookupByIsin("DE0005140008")).thenReturn(Optional.empty());

		assertThat(enrichmentService.enrich(position)).isSameAs(position);
	}

	@Test
	void lookupFailureKeepsCustodianData() {
		BankPosition position = position("PF-7", "DE0005140008", "EUR", "1000");
		when(productCatalog.lookupByIsin("DE0005140008")).thenThrow(new QueryTimeoutException("slow"));

		assertThat(enrichmentService.enrich(position)).isSameAs(position);
	}

	@Test
	void positionsWithoutIsinAreSkipped() {
		BankPosition cash = cash("PF-7", "EUR", "500");

		assertThat(enrichmentService.enrich(cash)).isSameAs(cash);
		verifyNoInteractions(productCatalog);
	}
}
