package my.custodyreconciler.app.service.util;

import my.custodyreconciler.app.model.AllocationCategory;
import my.custodyreconciler.app.model.CategoryAllocation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Folds the granular snapshot breakdown into the four categories an account profile limits.
 */
public final class AllocationCategoryUtil {
	private static final Set<String> CASH_KEYS = Set.of("cash", "monetary_products", "time_deposit");
	private static final Set<String> ALTERNATIVE_KEYS = Set.of("private_equity", "private_debt", "commodities",
			"real_estate", "hedge_fund", "derivatives", "other");
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	private AllocationCategoryUtil() {
	}

	public static AllocationCategory categorize(String categoryKey) {
		String key = categoryKey == null ? "" : categoryKey.toLowerCase(Locale.ROOT);
		if (CASH_KEYS.contains(key) || key.contains("money_market")) {
			return AllocationCategory.CASH;
		}
		if (key.contains("structured_product_capital_guaranteed") || key.contains("structured_product_capital_protected")) {
			return AllocationCategory.BONDS;
		}
		if (key.contains("fixed_income") || key.contains("bond") || key.equals("convertible")) {
			return AllocationCategory.BONDS;
		}
		// exact alternative keys first, private_equity would otherwise count as equity
		if (ALTERNATIVE_KEYS.contains(key)) {
			return AllocationCategory.ALTERNATIVE;
		}
		if (key.contains("equity") || key.contains("stock")) {
			return AllocationCategory.EQUITIES;
		}
		return AllocationCategory.ALTERNATIVE;
	}

	public static CategoryAllocation aggregate(Map<String, BigDecimal> breakdown, BigDecimal totalValue) {
		if (breakdown == null || breakdown.isEmpty() || totalValue == null || totalValue.signum() == 0) {
			return CategoryAllocation.empty();
		}
		Map<AllocationCategory, BigDecimal> sums = new EnumMap<>(AllocationCategory.class);
		for (AllocationCategory category : AllocationCategory.values()) {
			sums.put(category, BigDecimal.ZERO);
		}
		for (Map.Entry<String, BigDecimal> entry : breakdown.entrySet()) {
			if (entry.getValue() == null) {
				continue;
			}
			sums.merge(categorize(entry.getKey()), entry.getValue(), BigDecimal::add);
		}
		return new CategoryAllocation(
				percent(sums.get(AllocationCategory.CASH), totalValue),
				percent(sums.get(AllocationCategory.BONDS), totalValue),
				percent(sums.get(AllocationCategory.EQUITIES), totalValue),
				percent(sums.get(AllocationCategory.ALTERNATIVE), totalValue)
		);
	}

	private static BigDecimal percent(BigDecimal value, BigDecimal total) {
		return value.multiply(HUNDRED).divide(total, 2, RoundingMode.HALF_UP);
	}
}
