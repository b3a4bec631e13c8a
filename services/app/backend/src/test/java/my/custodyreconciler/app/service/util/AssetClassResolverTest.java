package my.custodyreconciler.app.service.util;

import my.custodyreconciler.app.domain.Holding;
import org.junit.jupiter.api.Test;

import static my.custodyreconciler.app.support.TestPositions.cashHolding;
import static my.custodyreconciler.app.support.TestPositions.holding;
import static org.assertj.core.api.Assertions.assertThat;

class AssetClassResolverTest {
	@Test
	void cashIsRecognizedByClassOrSecurityType() {
		assertThat(AssetClassResolver.isCash(cashHolding("PF-7", "EUR", "100"))).isTrue();
		assertThat(AssetClassResolver.isCash(null, "cash_account")).isTrue();
		assertThat(AssetClassResolver.isCash("equity", "stock")).isFalse();
	}

	@Test
	void structuredProductsAreKeyedByProtection() {
		Holding guaranteed = holding("PF-7", "CH0000000001", "structured_product", "EUR", "100");
		guaranteed.getBankSpecificData().put("capitalGuaranteed100", true);
		Holding barrier = holding("PF-7", "CH0000000002", "structured_product", "EUR", "100");
		barrier.getBankSpecificData().put("protectionType", "capital_protected_conditional");
		Holding linked = holding("PF-7", "CH0000000003", "structured_product", "EUR", "100");
		linked.getBankSpecificData().put("underlyingType", "equity_linked");

		assertThat(AssetClassResolver.categoryKey(guaranteed)).isEqualTo("structured_product_capital_guaranteed");
		assertThat(AssetClassResolver.categoryKey(barrier)).isEqualTo("structured_product_barrier_protected");
		assertThat(AssetClassResolver.categoryKey(linked)).isEqualTo("structured_product_equity_linked");
	}

	@Test
	void equityAndFixedIncomeTakeSubClass() {
		Holding equity = holding("PF-7", "US0000000001", "equity", "USD", "100");
		equity.getBankSpecificData().put("assetSubClass", "direct");
		Holding bond = holding("PF-7", "XS0000000001", "fixed_income", "USD", "100");
		bond.getBankSpecificData().put("assetSubClass", "fixed_income_fund");

		assertThat(AssetClassResolver.categoryKey(equity)).isEqualTo("equity_direct");
		assertThat(AssetClassResolver.categoryKey(bond)).isEqualTo("fixed_income_fund");
		assertThat(AssetClassResolver.categoryKey(holding("PF-7", "LU0000000001", "Fund", "EUR", "1")))
				.isEqualTo("fund");
	}

	@Test
	void missingClassFallsBackToNameHeuristics() {
		Holding autocall = holding("PF-7", "CH0000000004", null, "EUR", "100");
		autocall.setSecurityName("Phoenix Autocallable on SMI barrier 60%");
		Holding gold = holding("PF-7", "CH0000000005", "other", "USD", "100");
		gold.setSecurityName("Physical Gold Tracker");
		Holding bond = holding("PF-7", "US0000000006", null, "USD", "100");
		bond.setSecurityType("bond");
		bond.setSecurityName("US Treasury 2030");

		assertThat(AssetClassResolver.categoryKey(autocall)).isEqualTo("structured_product_barrier_protected");
		assertThat(AssetClassResolver.categoryKey(gold)).isEqualTo("commodities");
		assertThat(AssetClassResolver.categoryKey(bond)).isEqualTo("fixed_income_direct");
	}
}
