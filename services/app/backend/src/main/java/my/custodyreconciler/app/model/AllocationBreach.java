package my.custodyreconciler.app.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record AllocationBreach(
		AllocationCategory category,
		BigDecimal currentPercent,
		BigDecimal limitPercent
) {
	public String describe() {
		return category.label() + ": " + currentPercent.setScale(1, RoundingMode.HALF_UP).toPlainString()
				+ "% (limit: " + limitPercent.stripTrailingZeros().toPlainString() + "%)";
	}
}
