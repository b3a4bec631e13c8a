package my.custodyreconciler.app.model;

import java.math.BigDecimal;

/**
 * Share of the account value per profile category, in percent with two decimals.
 */
public record CategoryAllocation(
		BigDecimal cash,
		BigDecimal bonds,
		BigDecimal equities,
		BigDecimal alternative
) {
	public static CategoryAllocation empty() {
		return new CategoryAllocation(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
	}

	public BigDecimal percentOf(AllocationCategory category) {
		return switch (category) {
			case CASH -> cash;
			case BONDS -> bonds;
			case EQUITIES -> equities;
			case ALTERNATIVE -> alternative;
		};
	}
}
